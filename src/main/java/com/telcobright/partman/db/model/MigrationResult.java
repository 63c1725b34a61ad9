package com.telcobright.partman.db.model;

import com.telcobright.partman.db.entity.PartitionConfig;

import java.time.LocalDate;

/**
 * Outcome of converting a table to daily partitions.
 */
public class MigrationResult {

    private final String tableName;
    private final int partitionsCreated;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final PartitionConfig config;

    public MigrationResult(String tableName, int partitionsCreated, LocalDate startDate, LocalDate endDate,
                           PartitionConfig config) {
        this.tableName = tableName;
        this.partitionsCreated = partitionsCreated;
        this.startDate = startDate;
        this.endDate = endDate;
        this.config = config;
    }

    public String getTableName() { return tableName; }

    /**
     * Includes the trailing {@code p_future} partition.
     */
    public int getPartitionsCreated() { return partitionsCreated; }
    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }
    public PartitionConfig getConfig() { return config; }

    @Override
    public String toString() {
        return String.format("%s: %d partitions for %s..%s, config %s", tableName, partitionsCreated,
            startDate, endDate, config);
    }
}
