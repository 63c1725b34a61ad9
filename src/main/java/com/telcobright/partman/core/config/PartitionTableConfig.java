package com.telcobright.partman.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.telcobright.partman.core.enums.CleanupAction;

/**
 * Statically configured table, used to seed {@code partition_config} when the
 * table has no database-backed configuration yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PartitionTableConfig {

    private final String tableName;
    private final int retentionDays;
    private final int preCreateDays;
    private final CleanupAction cleanupAction;

    @JsonCreator
    public PartitionTableConfig(@JsonProperty("tableName") String tableName,
                                @JsonProperty("retentionDays") Integer retentionDays,
                                @JsonProperty("preCreateDays") Integer preCreateDays,
                                @JsonProperty("cleanupAction") CleanupAction cleanupAction) {
        this.tableName = tableName;
        this.retentionDays = retentionDays != null ? retentionDays : 30;
        this.preCreateDays = preCreateDays != null ? preCreateDays : 7;
        this.cleanupAction = cleanupAction != null ? cleanupAction : CleanupAction.DROP;
    }

    public String getTableName() { return tableName; }
    public int getRetentionDays() { return retentionDays; }
    public int getPreCreateDays() { return preCreateDays; }
    public CleanupAction getCleanupAction() { return cleanupAction; }

    @Override
    public String toString() {
        return String.format("%s[retention=%d, preCreate=%d, cleanup=%s]",
            tableName, retentionDays, preCreateDays, cleanupAction);
    }
}
