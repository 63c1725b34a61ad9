package com.telcobright.partman.db.service;

import com.telcobright.partman.core.enums.CleanupAction;

import java.time.LocalTime;

/**
 * Partial update of a partition configuration; null fields are left unchanged.
 */
public class PartitionConfigUpdate {

    private String tableName;
    private Integer retentionDays;
    private Integer preCreateDays;
    private CleanupAction cleanupAction;
    private Boolean enabled;
    private LocalTime scheduledTime;

    public String getTableName() { return tableName; }
    public PartitionConfigUpdate tableName(String tableName) { this.tableName = tableName; return this; }

    public Integer getRetentionDays() { return retentionDays; }
    public PartitionConfigUpdate retentionDays(Integer retentionDays) { this.retentionDays = retentionDays; return this; }

    public Integer getPreCreateDays() { return preCreateDays; }
    public PartitionConfigUpdate preCreateDays(Integer preCreateDays) { this.preCreateDays = preCreateDays; return this; }

    public CleanupAction getCleanupAction() { return cleanupAction; }
    public PartitionConfigUpdate cleanupAction(CleanupAction cleanupAction) { this.cleanupAction = cleanupAction; return this; }

    public Boolean getEnabled() { return enabled; }
    public PartitionConfigUpdate enabled(Boolean enabled) { this.enabled = enabled; return this; }

    public LocalTime getScheduledTime() { return scheduledTime; }
    public PartitionConfigUpdate scheduledTime(LocalTime scheduledTime) { this.scheduledTime = scheduledTime; return this; }
}
