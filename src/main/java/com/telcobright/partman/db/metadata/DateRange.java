package com.telcobright.partman.db.metadata;

import java.time.LocalDate;

/**
 * Earliest and latest calendar day found in a date/timestamp column.
 * Both dates are null for an empty table.
 */
public class DateRange {

    private final LocalDate earliest;
    private final LocalDate latest;
    private final long rowCount;
    private final long distinctDateCount;

    public DateRange(LocalDate earliest, LocalDate latest, long rowCount, long distinctDateCount) {
        this.earliest = earliest;
        this.latest = latest;
        this.rowCount = rowCount;
        this.distinctDateCount = distinctDateCount;
    }

    public LocalDate getEarliest() { return earliest; }
    public LocalDate getLatest() { return latest; }
    public long getRowCount() { return rowCount; }
    public long getDistinctDateCount() { return distinctDateCount; }

    public boolean isEmpty() {
        return earliest == null || latest == null;
    }
}
