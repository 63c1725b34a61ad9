package com.telcobright.partman.db.model;

/**
 * Span of dated partitions on a table and whether the MAXVALUE partition is present.
 */
public class PartitionCoverage {

    private final String tableName;
    private final String earliestPartition;
    private final String latestPartition;
    private final int totalPartitions;
    private final boolean hasFuturePartition;

    public PartitionCoverage(String tableName, String earliestPartition, String latestPartition,
                             int totalPartitions, boolean hasFuturePartition) {
        this.tableName = tableName;
        this.earliestPartition = earliestPartition;
        this.latestPartition = latestPartition;
        this.totalPartitions = totalPartitions;
        this.hasFuturePartition = hasFuturePartition;
    }

    public String getTableName() { return tableName; }
    public String getEarliestPartition() { return earliestPartition; }
    public String getLatestPartition() { return latestPartition; }
    public int getTotalPartitions() { return totalPartitions; }
    public boolean hasFuturePartition() { return hasFuturePartition; }

    @Override
    public String toString() {
        return String.format("%s: %s..%s (%d partitions%s)", tableName, earliestPartition, latestPartition,
            totalPartitions, hasFuturePartition ? ", p_future" : "");
    }
}
