package com.telcobright.partman;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.telcobright.partman.core.config.PartitionManagerConfig;
import com.telcobright.partman.core.enums.CleanupAction;
import com.telcobright.partman.core.enums.FailureStatus;
import com.telcobright.partman.core.partition.PartitionNaming;
import com.telcobright.partman.core.sql.mysql.MySQLPartitionSqlGenerator;
import com.telcobright.partman.db.connection.ConnectionProvider;
import com.telcobright.partman.db.entity.PartitionConfig;
import com.telcobright.partman.db.entity.PartitionFailure;
import com.telcobright.partman.db.metadata.PartitionInfo;
import com.telcobright.partman.db.metadata.SchemaIntrospector;
import com.telcobright.partman.db.model.FailureStats;
import com.telcobright.partman.db.model.MaintenanceRunReport;
import com.telcobright.partman.db.model.MaintenanceSummary;
import com.telcobright.partman.db.model.MigrationAnalysis;
import com.telcobright.partman.db.model.MigrationResult;
import com.telcobright.partman.db.model.PartitionCoverage;
import com.telcobright.partman.db.model.PartitionOperationResult;
import com.telcobright.partman.db.repository.JdbcPartitionConfigRepository;
import com.telcobright.partman.db.repository.MongoPartitionFailureRepository;
import com.telcobright.partman.db.repository.PartitionConfigRepository;
import com.telcobright.partman.db.repository.PartitionFailureRepository;
import com.telcobright.partman.db.scheduler.FailureRetryScheduler;
import com.telcobright.partman.db.scheduler.PartitionScheduler;
import com.telcobright.partman.db.service.MigrationService;
import com.telcobright.partman.db.service.PartitionConfigService;
import com.telcobright.partman.db.service.PartitionConfigUpdate;
import com.telcobright.partman.db.service.PartitionFailureService;
import com.telcobright.partman.db.service.PartitionLock;
import com.telcobright.partman.db.service.PartitionManagementService;
import com.telcobright.partman.db.service.PartitionRetryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for daily partition lifecycle management.
 * <p>
 * Wires the services over one JDBC data source and one failure store, and exposes the
 * operator actions: partition listing and coverage, manual drop/truncate, manual maintenance,
 * migration, configuration management and failure inspection/retry.
 *
 * <pre>
 * try (PartitionManager manager = PartitionManager.builder()
 *         .withConfig(PartitionManagerConfig.load())
 *         .build()) {
 *     manager.start();
 *     ...
 * }
 * </pre>
 */
public class PartitionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PartitionManager.class);

    private final PartitionManagerConfig config;
    private final ConnectionProvider connectionProvider;
    private final MongoClient mongoClient;
    private final ExecutorService workers;

    private final PartitionConfigService configService;
    private final PartitionFailureService failureService;
    private final PartitionManagementService managementService;
    private final PartitionRetryService retryService;
    private final MigrationService migrationService;
    private final PartitionScheduler partitionScheduler;
    private final FailureRetryScheduler retryScheduler;

    private PartitionManager(Builder builder) {
        this.config = builder.config;
        Clock clock = builder.clock;

        DataSource dataSource = builder.dataSource;
        if (dataSource == null) {
            this.connectionProvider = new ConnectionProvider(config.getDataSourceConfig(), config.getWorkerThreads() + 2);
            dataSource = connectionProvider.getDataSource();
        } else {
            this.connectionProvider = null;
        }

        PartitionFailureRepository failureRepository = builder.failureRepository;
        if (failureRepository == null) {
            this.mongoClient = MongoClients.create(config.getMongoUri());
            failureRepository = new MongoPartitionFailureRepository(
                mongoClient.getDatabase(config.getMongoDatabase()), clock);
        } else {
            this.mongoClient = null;
        }

        PartitionConfigRepository configRepository = builder.configRepository != null
            ? builder.configRepository
            : new JdbcPartitionConfigRepository(dataSource);

        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "partition-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        MySQLPartitionSqlGenerator sqlGenerator = new MySQLPartitionSqlGenerator();
        SchemaIntrospector introspector = new SchemaIntrospector(dataSource, sqlGenerator);
        PartitionNaming naming = PartitionNaming.ofOffsetMillis(config.getTimezoneOffsetMs());

        this.configService = new PartitionConfigService(configRepository, introspector);
        this.failureService = new PartitionFailureService(failureRepository, clock);
        this.managementService = new PartitionManagementService(dataSource, introspector, sqlGenerator, naming,
            failureService, workers, clock);
        this.retryService = new PartitionRetryService(failureService, managementService, config.getRetryInterval());
        this.migrationService = new MigrationService(dataSource, introspector, sqlGenerator, naming, configService,
            config.getMigrationSourceColumn(), config.getScheduledTime(), clock);
        this.partitionScheduler = new PartitionScheduler(configService, managementService,
            new PartitionLock(configRepository), workers, naming.getZoneOffset(), config.getTickInterval(),
            config.isEnabled(), clock);
        this.retryScheduler = new FailureRetryScheduler(retryService, config.getRetryInterval());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Prepares the stores, seeds statically listed tables and, when enabled, starts the
     * maintenance and retry schedulers.
     *
     * @throws SQLException if the configuration table cannot be created
     */
    public void start() throws SQLException {
        configService.initialize();
        try {
            failureService.initialize();
        } catch (SQLException e) {
            logger.error("Failure store indexes could not be ensured; failures may not be recorded", e);
        }

        if (!config.getTables().isEmpty()) {
            int seeded = configService.seedStaticTables(config.getTables(), config.getScheduledTime());
            logger.info("Seeded {} of {} statically configured tables", seeded, config.getTables().size());
        }

        partitionScheduler.start();
        if (config.isEnabled()) {
            retryScheduler.start();
        }
        logger.info("PartitionManager started (enabled={}, cron='{}')", config.isEnabled(), config.getCronSchedule());
    }

    @Override
    public void close() {
        logger.info("PartitionManager shutting down...");
        retryScheduler.stop();
        partitionScheduler.stop();

        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (mongoClient != null) {
            mongoClient.close();
        }
        if (connectionProvider != null) {
            connectionProvider.close();
        }
        logger.info("PartitionManager shutdown complete");
    }

    // Partitions

    public List<PartitionInfo> listPartitions(String tableName) throws SQLException {
        return managementService.listPartitions(tableName);
    }

    public PartitionCoverage getCoverage(String tableName) throws SQLException {
        return managementService.getCoverage(tableName);
    }

    public boolean createPartition(String tableName, LocalDate date) throws SQLException {
        return managementService.createPartition(tableName, date);
    }

    public PartitionOperationResult dropPartition(String tableName, LocalDate date) throws SQLException {
        return managementService.dropPartitionByDate(tableName, date);
    }

    public PartitionOperationResult truncatePartition(String tableName, LocalDate date) throws SQLException {
        return managementService.truncatePartitionByDate(tableName, date);
    }

    // Maintenance

    public List<MaintenanceRunReport> triggerMaintenance() throws SQLException {
        return partitionScheduler.triggerManualMaintenance();
    }

    public MaintenanceRunReport triggerMaintenance(String tableName) throws SQLException {
        return partitionScheduler.triggerManualMaintenance(tableName);
    }

    // Migration

    public MigrationAnalysis analyzeTable(String tableName) throws SQLException {
        return migrationService.analyzeTableForMigration(tableName);
    }

    public MigrationResult migrateTable(String tableName, int retentionDays, int preCreateDays,
                                        CleanupAction cleanupAction) throws SQLException {
        return migrationService.migrateTableToPartitions(tableName, retentionDays, preCreateDays, cleanupAction);
    }

    // Configuration

    public List<PartitionConfig> getConfigs() throws SQLException {
        return configService.getAllConfigs();
    }

    public PartitionConfig getConfig(long id) throws SQLException {
        return configService.getConfig(id);
    }

    public PartitionConfig createConfig(PartitionConfig partitionConfig) throws SQLException {
        return configService.createConfig(partitionConfig);
    }

    public PartitionConfig updateConfig(long id, PartitionConfigUpdate update) throws SQLException {
        return configService.updateConfig(id, update);
    }

    public void deleteConfig(long id) throws SQLException {
        configService.deleteConfig(id);
    }

    public PartitionConfig clearStuckLock(long id) throws SQLException {
        return configService.clearStuckLock(id);
    }

    // Failures

    /**
     * @param status filter, or null for all records
     */
    public List<PartitionFailure> getFailures(FailureStatus status) throws SQLException {
        return failureService.getFailures(status);
    }

    public List<PartitionFailure> getPendingFailures() throws SQLException {
        return failureService.getPendingFailures();
    }

    public List<PartitionFailure> getDeadFailures() throws SQLException {
        return failureService.getDeadFailures();
    }

    public List<PartitionFailure> getFailuresByTable(String tableName) throws SQLException {
        return failureService.getFailuresByTable(tableName);
    }

    public FailureStats getFailureStats() throws SQLException {
        return failureService.getStats();
    }

    public PartitionFailure retryFailure(String id) throws SQLException {
        return retryService.retryById(id);
    }

    public MaintenanceSummary retryFailedPartitions() throws SQLException {
        return retryService.retryFailedPartitions();
    }

    public PartitionManagerConfig getConfiguration() {
        return config;
    }

    public static class Builder {
        private PartitionManagerConfig config;
        private DataSource dataSource;
        private PartitionConfigRepository configRepository;
        private PartitionFailureRepository failureRepository;
        private Clock clock = Clock.systemUTC();

        public Builder withConfig(PartitionManagerConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Use an existing data source instead of opening a pool from the configuration.
         * The caller keeps ownership and closes it.
         */
        public Builder withDataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder withConfigRepository(PartitionConfigRepository configRepository) {
            this.configRepository = configRepository;
            return this;
        }

        /**
         * Use an existing failure store instead of connecting to MongoDB from the configuration.
         */
        public Builder withFailureRepository(PartitionFailureRepository failureRepository) {
            this.failureRepository = failureRepository;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PartitionManager build() {
            if (config == null) {
                throw new IllegalArgumentException("PartitionManagerConfig is required");
            }
            if (dataSource == null && config.getDataSourceConfig() == null) {
                throw new IllegalArgumentException("Either a DataSource or database settings are required");
            }
            if (clock == null) {
                throw new IllegalArgumentException("Clock is required");
            }
            return new PartitionManager(this);
        }
    }
}
