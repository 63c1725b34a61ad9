package com.telcobright.partman.core.exception;

/**
 * The requested change collides with existing state, e.g. a configuration
 * already exists for the table or the table is already partitioned.
 */
public class ConflictException extends PartitionException {

    public ConflictException(String message) {
        super(message);
    }
}
