package com.telcobright.partman.core.exception;

import java.sql.SQLException;

/**
 * Base type for failures raised while managing partitions or their configuration.
 */
public class PartitionException extends SQLException {

    public PartitionException(String message) {
        super(message);
    }

    public PartitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public PartitionException(String message, String sqlState, int vendorCode, Throwable cause) {
        super(message, sqlState, vendorCode, cause);
    }
}
