package com.telcobright.partman.db.entity;

import com.telcobright.partman.core.enums.FailureAction;
import com.telcobright.partman.core.enums.FailureStatus;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Failed partition DDL for one (table, partition) pair, kept in the failure store.
 */
public class PartitionFailure {

    private String id;
    private String tableName;
    private String partitionName;
    private LocalDate partitionDate;
    private FailureAction action = FailureAction.CREATE;
    private FailureStatus status = FailureStatus.PENDING;
    private int retryCount;
    private int maxRetry = FailureAction.CREATE.getDefaultMaxRetry();
    private String errorMessage;
    private String errorCode;
    private String errorStack;
    private Instant lastRetryAt;
    private Instant resolvedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTableName() { return tableName; }
    public void setTableName(String tableName) { this.tableName = tableName; }

    public String getPartitionName() { return partitionName; }
    public void setPartitionName(String partitionName) { this.partitionName = partitionName; }

    /**
     * Logical day the partition represents.
     */
    public LocalDate getPartitionDate() { return partitionDate; }
    public void setPartitionDate(LocalDate partitionDate) { this.partitionDate = partitionDate; }

    public FailureAction getAction() { return action; }
    public void setAction(FailureAction action) { this.action = action; }

    public FailureStatus getStatus() { return status; }
    public void setStatus(FailureStatus status) { this.status = status; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public int getMaxRetry() { return maxRetry; }
    public void setMaxRetry(int maxRetry) { this.maxRetry = maxRetry; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getErrorCode() { return errorCode; }
    public void setErrorCode(String errorCode) { this.errorCode = errorCode; }

    public String getErrorStack() { return errorStack; }
    public void setErrorStack(String errorStack) { this.errorStack = errorStack; }

    public Instant getLastRetryAt() { return lastRetryAt; }
    public void setLastRetryAt(Instant lastRetryAt) { this.lastRetryAt = lastRetryAt; }

    public Instant getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return String.format("PartitionFailure[%s.%s, action=%s, status=%s, retry=%d/%d]",
            tableName, partitionName, action, status, retryCount, maxRetry);
    }
}
