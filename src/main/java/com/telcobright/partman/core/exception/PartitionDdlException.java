package com.telcobright.partman.core.exception;

import java.sql.SQLException;

/**
 * DDL statement rejected by the database engine.
 * Carries the engine's vendor code and original message for the caller.
 */
public class PartitionDdlException extends PartitionException {

    private final String tableName;
    private final String partitionName;
    private final String engineMessage;

    public PartitionDdlException(String tableName, String partitionName, SQLException cause) {
        super(String.format("Partition operation on %s.%s failed [%d]: %s",
                tableName, partitionName, cause.getErrorCode(), cause.getMessage()),
            cause.getSQLState(), cause.getErrorCode(), cause);
        this.tableName = tableName;
        this.partitionName = partitionName;
        this.engineMessage = cause.getMessage();
    }

    public String getTableName() {
        return tableName;
    }

    public String getPartitionName() {
        return partitionName;
    }

    public String getEngineMessage() {
        return engineMessage;
    }
}
