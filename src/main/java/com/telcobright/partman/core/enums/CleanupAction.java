package com.telcobright.partman.core.enums;

/**
 * What happens to a partition once it falls out of the retention window.
 */
public enum CleanupAction {

    // Remove the partition and its rows
    DROP,

    // Remove the rows, keep the empty partition
    TRUNCATE
}
