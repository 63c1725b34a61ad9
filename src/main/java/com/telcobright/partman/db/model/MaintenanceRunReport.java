package com.telcobright.partman.db.model;

/**
 * What a locked maintenance run did for one table.
 */
public class MaintenanceRunReport {

    public enum Outcome {
        COMPLETED,
        // Another run holds the table's lock
        SKIPPED_LOCKED,
        FAILED
    }

    private final String tableName;
    private final Outcome outcome;
    private final MaintenanceSummary creation;
    private final MaintenanceSummary cleanup;
    private final String error;

    private MaintenanceRunReport(String tableName, Outcome outcome, MaintenanceSummary creation,
                                 MaintenanceSummary cleanup, String error) {
        this.tableName = tableName;
        this.outcome = outcome;
        this.creation = creation;
        this.cleanup = cleanup;
        this.error = error;
    }

    public static MaintenanceRunReport completed(String tableName, MaintenanceSummary creation, MaintenanceSummary cleanup) {
        return new MaintenanceRunReport(tableName, Outcome.COMPLETED, creation, cleanup, null);
    }

    public static MaintenanceRunReport skipped(String tableName) {
        return new MaintenanceRunReport(tableName, Outcome.SKIPPED_LOCKED, MaintenanceSummary.empty(),
            MaintenanceSummary.empty(), null);
    }

    public static MaintenanceRunReport failed(String tableName, Throwable error) {
        return new MaintenanceRunReport(tableName, Outcome.FAILED, MaintenanceSummary.empty(),
            MaintenanceSummary.empty(), error.getMessage());
    }

    public String getTableName() { return tableName; }
    public Outcome getOutcome() { return outcome; }
    public MaintenanceSummary getCreation() { return creation; }
    public MaintenanceSummary getCleanup() { return cleanup; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return String.format("%s %s [create: %s] [cleanup: %s]%s", tableName, outcome, creation, cleanup,
            error != null ? " " + error : "");
    }
}
