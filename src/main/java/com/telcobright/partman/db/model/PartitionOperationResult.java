package com.telcobright.partman.db.model;

/**
 * Result of an operator-triggered drop or truncate.
 */
public class PartitionOperationResult {

    private final boolean success;
    private final String message;

    public PartitionOperationResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return (success ? "OK: " : "FAILED: ") + message;
    }
}
