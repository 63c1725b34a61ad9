package com.telcobright.partman.db.model;

import com.telcobright.partman.db.metadata.ColumnInfo;
import com.telcobright.partman.db.metadata.DateRange;
import com.telcobright.partman.db.metadata.TableStats;

/**
 * Readiness report for converting a table to daily partitions.
 */
public class MigrationAnalysis {

    // Rough DDL throughput used for the time estimate
    static final long ROWS_PER_SECOND = 10_000;

    private final String tableName;
    private final boolean partitioned;
    private final ColumnInfo sourceColumn;
    private final TableStats tableStats;
    private final DateRange dateRange;

    public MigrationAnalysis(String tableName, boolean partitioned, ColumnInfo sourceColumn,
                             TableStats tableStats, DateRange dateRange) {
        this.tableName = tableName;
        this.partitioned = partitioned;
        this.sourceColumn = sourceColumn;
        this.tableStats = tableStats;
        this.dateRange = dateRange;
    }

    public String getTableName() { return tableName; }
    public boolean isPartitioned() { return partitioned; }
    public ColumnInfo getSourceColumn() { return sourceColumn; }
    public TableStats getTableStats() { return tableStats; }
    public DateRange getDateRange() { return dateRange; }

    public long getActualRows() {
        return dateRange.getRowCount();
    }

    public String getEstimatedMigrationTime() {
        return estimateMigrationTime(dateRange.getRowCount());
    }

    static String estimateMigrationTime(long rows) {
        long seconds = (rows + ROWS_PER_SECOND - 1) / ROWS_PER_SECOND;
        if (seconds < 60) {
            return seconds + " seconds";
        }
        if (seconds < 3600) {
            return ceilDiv(seconds, 60) + " minutes";
        }
        return ceilDiv(seconds, 3600) + " hours";
    }

    private static long ceilDiv(long value, long divisor) {
        return (value + divisor - 1) / divisor;
    }

    @Override
    public String toString() {
        return String.format("%s partitioned=%s rows=%d data=%.2fMB index=%.2fMB dates=%s..%s (%d unique) estimate=%s",
            tableName, partitioned, getActualRows(), tableStats.getDataSizeMb(), tableStats.getIndexSizeMb(),
            dateRange.getEarliest(), dateRange.getLatest(), dateRange.getDistinctDateCount(),
            getEstimatedMigrationTime());
    }
}
