package com.telcobright.partman.core.enums;

/**
 * Status of a recorded partition failure.
 * RESOLVED and DEAD are terminal; RETRYING is held only while an attempt is in flight.
 */
public enum FailureStatus {
    PENDING,
    RETRYING,
    RESOLVED,
    DEAD;

    public boolean isRetryable() {
        return this == PENDING || this == RETRYING;
    }
}
