package com.telcobright.partman.core.exception;

/**
 * A table, column, configuration or failure record does not exist.
 */
public class NotFoundException extends PartitionException {

    public NotFoundException(String message) {
        super(message);
    }
}
