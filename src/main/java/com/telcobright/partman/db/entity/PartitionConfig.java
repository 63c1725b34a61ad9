package com.telcobright.partman.db.entity;

import com.telcobright.partman.core.enums.CleanupAction;

import java.time.Instant;
import java.time.LocalTime;

/**
 * Row of {@code partition_config}: one managed table and its retention policy.
 * {@code running} is the per-table maintenance lock flag.
 */
public class PartitionConfig {

    private Long id;
    private String tableName;
    private int retentionDays = 30;
    private int preCreateDays = 7;
    private CleanupAction cleanupAction = CleanupAction.DROP;
    private boolean enabled = true;
    private LocalTime scheduledTime = LocalTime.MIDNIGHT;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private boolean running;
    private Instant createdAt;
    private Instant updatedAt;

    public PartitionConfig() {
    }

    public PartitionConfig(String tableName, int retentionDays, int preCreateDays, CleanupAction cleanupAction) {
        this.tableName = tableName;
        this.retentionDays = retentionDays;
        this.preCreateDays = preCreateDays;
        this.cleanupAction = cleanupAction;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getTableName() { return tableName; }
    public void setTableName(String tableName) { this.tableName = tableName; }

    public int getRetentionDays() { return retentionDays; }
    public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }

    public int getPreCreateDays() { return preCreateDays; }
    public void setPreCreateDays(int preCreateDays) { this.preCreateDays = preCreateDays; }

    public CleanupAction getCleanupAction() { return cleanupAction; }
    public void setCleanupAction(CleanupAction cleanupAction) { this.cleanupAction = cleanupAction; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    /**
     * Time of day, at the configured timezone offset, when this table is maintained.
     */
    public LocalTime getScheduledTime() { return scheduledTime; }
    public void setScheduledTime(LocalTime scheduledTime) { this.scheduledTime = scheduledTime; }

    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }

    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }

    public boolean isRunning() { return running; }
    public void setRunning(boolean running) { this.running = running; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return String.format("PartitionConfig[id=%s, table=%s, retention=%d, preCreate=%d, cleanup=%s, enabled=%s, at=%s]",
            id, tableName, retentionDays, preCreateDays, cleanupAction, enabled, scheduledTime);
    }
}
