package com.telcobright.partman.db.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a batch of isolated partition units (one table-day or one partition each).
 * Not thread-safe; each task fills its own summary and summaries are merged after joining.
 */
public class MaintenanceSummary {

    private int succeeded;
    private int skipped;
    private int failed;
    private final List<String> errors = new ArrayList<>();

    public static MaintenanceSummary empty() {
        return new MaintenanceSummary();
    }

    public void recordSuccess() {
        succeeded++;
    }

    /**
     * Unit needed no work, e.g. the partition already existed.
     */
    public void recordSkipped() {
        skipped++;
    }

    public void recordFailure(String unit, Throwable error) {
        failed++;
        errors.add(unit + ": " + error.getMessage());
    }

    public MaintenanceSummary merge(MaintenanceSummary other) {
        MaintenanceSummary merged = new MaintenanceSummary();
        merged.succeeded = succeeded + other.succeeded;
        merged.skipped = skipped + other.skipped;
        merged.failed = failed + other.failed;
        merged.errors.addAll(errors);
        merged.errors.addAll(other.errors);
        return merged;
    }

    public int getSucceeded() { return succeeded; }
    public int getSkipped() { return skipped; }
    public int getFailed() { return failed; }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }

    public boolean hasFailures() {
        return failed > 0;
    }

    @Override
    public String toString() {
        return String.format("succeeded=%d, skipped=%d, failed=%d", succeeded, skipped, failed);
    }
}
