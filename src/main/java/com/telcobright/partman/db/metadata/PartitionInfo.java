package com.telcobright.partman.db.metadata;

import com.telcobright.partman.core.partition.PartitionNaming;

import java.time.LocalDateTime;

/**
 * One row of {@code information_schema.partitions} for a managed table.
 */
public class PartitionInfo {

    private final String name;
    private final String description;
    private final long rowCount;
    private final long dataLength;
    private final LocalDateTime createTime;

    public PartitionInfo(String name, String description, long rowCount, long dataLength, LocalDateTime createTime) {
        this.name = name;
        this.description = description;
        this.rowCount = rowCount;
        this.dataLength = dataLength;
        this.createTime = createTime;
    }

    public String getName() { return name; }

    /**
     * Bound as reported by the engine, e.g. {@code 739601} or {@code MAXVALUE}.
     */
    public String getDescription() { return description; }
    public long getRowCount() { return rowCount; }
    public long getDataLength() { return dataLength; }
    public LocalDateTime getCreateTime() { return createTime; }

    public boolean isFuturePartition() {
        return PartitionNaming.FUTURE_PARTITION.equals(name);
    }

    @Override
    public String toString() {
        return name + "(" + description + ")";
    }
}
