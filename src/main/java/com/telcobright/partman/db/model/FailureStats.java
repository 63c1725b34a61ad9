package com.telcobright.partman.db.model;

/**
 * Failure record counts per status.
 */
public class FailureStats {

    private final long total;
    private final long pending;
    private final long retrying;
    private final long resolved;
    private final long dead;

    public FailureStats(long total, long pending, long retrying, long resolved, long dead) {
        this.total = total;
        this.pending = pending;
        this.retrying = retrying;
        this.resolved = resolved;
        this.dead = dead;
    }

    public long getTotal() { return total; }
    public long getPending() { return pending; }
    public long getRetrying() { return retrying; }
    public long getResolved() { return resolved; }
    public long getDead() { return dead; }

    @Override
    public String toString() {
        return String.format("total=%d, pending=%d, retrying=%d, resolved=%d, dead=%d",
            total, pending, retrying, resolved, dead);
    }
}
