package com.telcobright.partman.core.exception;

/**
 * The failure store could not be read or written.
 */
public class FailureStoreException extends PartitionException {

    public FailureStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
