package com.telcobright.partman.db.metadata;

/**
 * Size estimates from {@code information_schema.tables}.
 */
public class TableStats {

    private final long estimatedRows;
    private final long dataSizeBytes;
    private final long indexSizeBytes;

    public TableStats(long estimatedRows, long dataSizeBytes, long indexSizeBytes) {
        this.estimatedRows = estimatedRows;
        this.dataSizeBytes = dataSizeBytes;
        this.indexSizeBytes = indexSizeBytes;
    }

    public long getEstimatedRows() { return estimatedRows; }
    public long getDataSizeBytes() { return dataSizeBytes; }
    public long getIndexSizeBytes() { return indexSizeBytes; }

    public double getDataSizeMb() {
        return toMegabytes(dataSizeBytes);
    }

    public double getIndexSizeMb() {
        return toMegabytes(indexSizeBytes);
    }

    private static double toMegabytes(long bytes) {
        return Math.round(bytes / 1024.0 / 1024.0 * 100) / 100.0;
    }
}
