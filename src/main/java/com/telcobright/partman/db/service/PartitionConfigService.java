package com.telcobright.partman.db.service;

import com.telcobright.partman.core.config.PartitionTableConfig;
import com.telcobright.partman.core.exception.ConflictException;
import com.telcobright.partman.core.exception.NotFoundException;
import com.telcobright.partman.core.sql.IdentifierValidator;
import com.telcobright.partman.db.entity.PartitionConfig;
import com.telcobright.partman.db.metadata.SchemaIntrospector;
import com.telcobright.partman.db.repository.PartitionConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Operator-facing management of per-table partition policies.
 */
public class PartitionConfigService {

    private static final Logger logger = LoggerFactory.getLogger(PartitionConfigService.class);

    private final PartitionConfigRepository repository;
    private final SchemaIntrospector introspector;

    public PartitionConfigService(PartitionConfigRepository repository, SchemaIntrospector introspector) {
        this.repository = repository;
        this.introspector = introspector;
    }

    public void initialize() throws SQLException {
        repository.ensureSchema();
    }

    public List<PartitionConfig> getAllConfigs() throws SQLException {
        return repository.findAll();
    }

    /**
     * Enabled configurations, the set scheduled maintenance runs against.
     */
    public List<PartitionConfig> getActiveConfigs() throws SQLException {
        return repository.findEnabled();
    }

    public PartitionConfig getConfig(long id) throws SQLException {
        return repository.findById(id)
            .orElseThrow(() -> new NotFoundException("Partition config not found: " + id));
    }

    public Optional<PartitionConfig> findByTableName(String tableName) throws SQLException {
        IdentifierValidator.validate(tableName, "table name");
        return repository.findByTableName(tableName);
    }

    public PartitionConfig createConfig(PartitionConfig config) throws SQLException {
        validate(config);
        if (repository.findByTableName(config.getTableName()).isPresent()) {
            throw new ConflictException("Partition config for table " + config.getTableName() + " already exists");
        }
        requireTable(config.getTableName());
        PartitionConfig created = repository.insert(config);
        logger.info("Created partition config {}", created);
        return created;
    }

    public PartitionConfig updateConfig(long id, PartitionConfigUpdate update) throws SQLException {
        PartitionConfig config = getConfig(id);

        if (update.getTableName() != null && !update.getTableName().equals(config.getTableName())) {
            IdentifierValidator.validate(update.getTableName(), "table name");
            if (repository.findByTableName(update.getTableName()).isPresent()) {
                throw new ConflictException("Partition config for table " + update.getTableName() + " already exists");
            }
            requireTable(update.getTableName());
            config.setTableName(update.getTableName());
        }
        if (update.getRetentionDays() != null) {
            config.setRetentionDays(update.getRetentionDays());
        }
        if (update.getPreCreateDays() != null) {
            config.setPreCreateDays(update.getPreCreateDays());
        }
        if (update.getCleanupAction() != null) {
            config.setCleanupAction(update.getCleanupAction());
        }
        if (update.getEnabled() != null) {
            config.setEnabled(update.getEnabled());
        }
        if (update.getScheduledTime() != null) {
            config.setScheduledTime(update.getScheduledTime());
        }

        validate(config);
        PartitionConfig updated = repository.update(config);
        logger.info("Updated partition config {}", updated);
        return updated;
    }

    /**
     * Removes the policy only; partitions already created on the table are left in place.
     */
    public void deleteConfig(long id) throws SQLException {
        if (!repository.delete(id)) {
            throw new NotFoundException("Partition config not found: " + id);
        }
        logger.info("Deleted partition config {}", id);
    }

    /**
     * Clears a lock left behind by a run that never finished. Only safe once the operator has
     * confirmed no maintenance is running on the table.
     */
    public PartitionConfig clearStuckLock(long id) throws SQLException {
        PartitionConfig config = getConfig(id);
        repository.releaseLock(id);
        logger.warn("Cleared running flag on partition config {} ({}), was {}",
            id, config.getTableName(), config.isRunning() ? "set" : "already clear");
        return getConfig(id);
    }

    public void recordRun(long id, Instant lastRunAt, Instant nextRunAt) throws SQLException {
        repository.updateRunTimes(id, lastRunAt, nextRunAt);
    }

    /**
     * Inserts a configuration for every statically listed table that has none yet.
     * Tables not yet created in the database are seeded too; maintenance reports them until they appear.
     *
     * @return number of configurations inserted
     */
    public int seedStaticTables(List<PartitionTableConfig> tables, LocalTime scheduledTime) throws SQLException {
        int inserted = 0;
        for (PartitionTableConfig table : tables) {
            PartitionConfig config = new PartitionConfig(table.getTableName(), table.getRetentionDays(),
                table.getPreCreateDays(), table.getCleanupAction());
            config.setScheduledTime(scheduledTime);
            try {
                validate(config);
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring static table entry {}: {}", table, e.getMessage());
                continue;
            }
            if (repository.findByTableName(config.getTableName()).isPresent()) {
                continue;
            }
            try {
                repository.insert(config);
                inserted++;
                logger.info("Seeded partition config for {}", table);
            } catch (ConflictException e) {
                logger.debug("Partition config for {} was created concurrently", table.getTableName());
            }
        }
        return inserted;
    }

    private void requireTable(String tableName) throws SQLException {
        if (!introspector.tableExists(tableName)) {
            throw new NotFoundException("Table " + tableName + " does not exist");
        }
    }

    static void validate(PartitionConfig config) {
        IdentifierValidator.validate(config.getTableName(), "table name");
        if (config.getRetentionDays() < 1) {
            throw new IllegalArgumentException("retentionDays must be at least 1, got " + config.getRetentionDays());
        }
        if (config.getPreCreateDays() < 1) {
            throw new IllegalArgumentException("preCreateDays must be at least 1, got " + config.getPreCreateDays());
        }
        if (config.getCleanupAction() == null) {
            throw new IllegalArgumentException("cleanupAction is required");
        }
        if (config.getScheduledTime() == null) {
            throw new IllegalArgumentException("scheduledTime is required");
        }
    }
}
