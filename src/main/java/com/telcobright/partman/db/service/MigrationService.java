package com.telcobright.partman.db.service;

import com.telcobright.partman.core.enums.CleanupAction;
import com.telcobright.partman.core.exception.ConflictException;
import com.telcobright.partman.core.exception.NotFoundException;
import com.telcobright.partman.core.exception.PartitionException;
import com.telcobright.partman.core.partition.PartitionDefinition;
import com.telcobright.partman.core.partition.PartitionNaming;
import com.telcobright.partman.core.sql.IdentifierValidator;
import com.telcobright.partman.core.sql.mysql.MySQLPartitionSqlGenerator;
import com.telcobright.partman.db.entity.PartitionConfig;
import com.telcobright.partman.db.metadata.ColumnInfo;
import com.telcobright.partman.db.metadata.DateRange;
import com.telcobright.partman.db.metadata.SchemaIntrospector;
import com.telcobright.partman.db.metadata.TableStats;
import com.telcobright.partman.db.model.MigrationAnalysis;
import com.telcobright.partman.db.model.MigrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts an existing unpartitioned table to daily RANGE partitions on a derived
 * {@code partition_date} column.
 * <p>
 * Steps are not transactional. Each one checks whether it was already applied, so a
 * migration that failed halfway can simply be run again.
 */
public class MigrationService {

    private static final Logger logger = LoggerFactory.getLogger(MigrationService.class);

    public static final String PARTITION_COLUMN = "partition_date";
    public static final String PARTITION_INDEX = "idx_partition_date";

    static final int ER_DUP_KEYNAME = 1061;

    private final DataSource dataSource;
    private final SchemaIntrospector introspector;
    private final MySQLPartitionSqlGenerator sqlGenerator;
    private final PartitionNaming naming;
    private final PartitionConfigService configService;
    private final String sourceColumn;
    private final LocalTime defaultScheduledTime;
    private final Clock clock;

    public MigrationService(DataSource dataSource, SchemaIntrospector introspector,
                            MySQLPartitionSqlGenerator sqlGenerator, PartitionNaming naming,
                            PartitionConfigService configService, String sourceColumn,
                            LocalTime defaultScheduledTime, Clock clock) {
        this.dataSource = dataSource;
        this.introspector = introspector;
        this.sqlGenerator = sqlGenerator;
        this.naming = naming;
        this.configService = configService;
        IdentifierValidator.validate(sourceColumn, "column name");
        this.sourceColumn = sourceColumn;
        this.defaultScheduledTime = defaultScheduledTime;
        this.clock = clock;
    }

    public MigrationAnalysis analyzeTableForMigration(String tableName) throws SQLException {
        IdentifierValidator.validate(tableName, "table name");
        if (!introspector.tableExists(tableName)) {
            throw new NotFoundException("Table " + tableName + " does not exist");
        }
        TableStats stats = introspector.tableStats(tableName).orElse(new TableStats(0, 0, 0));
        ColumnInfo column = introspector.columnInfo(tableName, sourceColumn)
            .orElseThrow(() -> new NotFoundException("Column '" + sourceColumn + "' not found in table " + tableName));
        DateRange range = introspector.dateRange(tableName, sourceColumn, dayOffset(column));
        boolean partitioned = introspector.isPartitioned(tableName);

        MigrationAnalysis analysis = new MigrationAnalysis(tableName, partitioned, column, stats, range);
        logger.info("Migration analysis: {}", analysis);
        return analysis;
    }

    public MigrationResult migrateTableToPartitions(String tableName, int retentionDays, int preCreateDays,
                                                    CleanupAction cleanupAction) throws SQLException {
        PartitionConfig config = new PartitionConfig(tableName, retentionDays, preCreateDays, cleanupAction);
        config.setScheduledTime(defaultScheduledTime);
        PartitionConfigService.validate(config);

        logger.info("Starting migration of {}", tableName);
        MigrationAnalysis analysis = analyzeTableForMigration(tableName);
        if (analysis.isPartitioned()) {
            throw new ConflictException("Table " + tableName + " is already partitioned");
        }

        preparePartitionColumn(tableName, dayOffset(analysis.getSourceColumn()));
        ensurePartitionIndex(tableName);
        extendPrimaryKey(tableName);

        LocalDate earliest = analysis.getDateRange().getEarliest();
        LocalDate latest = analysis.getDateRange().getLatest();
        if (analysis.getDateRange().isEmpty()) {
            earliest = naming.today(clock);
            latest = earliest;
            logger.info("{} holds no dated rows, partitioning from {}", tableName, earliest);
        }

        List<PartitionDefinition> plan = buildPartitionPlan(earliest, latest, preCreateDays, naming);
        logger.info("Applying {} partitions to {} ({}..{})", plan.size(), tableName, earliest, latest);
        execute(tableName, "apply partitioning",
            sqlGenerator.generatePartitionByRange(tableName, PARTITION_COLUMN, plan));

        PartitionConfig stored = registerConfig(config);
        logger.info("Migration of {} completed", tableName);
        return new MigrationResult(tableName, plan.size(), earliest, latest, stored);
    }

    /**
     * One partition per day from {@code earliest} to {@code latest} inclusive, {@code preCreateDays}
     * more after {@code latest}, then {@code p_future}.
     */
    public static List<PartitionDefinition> buildPartitionPlan(LocalDate earliest, LocalDate latest,
                                                               int preCreateDays, PartitionNaming naming) {
        if (latest.isBefore(earliest)) {
            throw new IllegalArgumentException("Latest date " + latest + " is before earliest date " + earliest);
        }
        List<PartitionDefinition> plan = new ArrayList<>();
        LocalDate last = latest.plusDays(preCreateDays);
        for (LocalDate date = earliest; !date.isAfter(last); date = date.plusDays(1)) {
            plan.add(PartitionDefinition.lessThan(naming.partitionName(date), naming.boundaryValue(date)));
        }
        plan.add(PartitionDefinition.maxValue(PartitionNaming.FUTURE_PARTITION));
        return plan;
    }

    /**
     * Days of a TIMESTAMP source are taken at the partition offset, the way partitions are named.
     * DATETIME values already hold local wall-clock time.
     */
    private ZoneOffset dayOffset(ColumnInfo source) {
        return source.isTimestamp() ? naming.getZoneOffset() : null;
    }

    /**
     * Adds, back-fills and constrains the partition column. A column left nullable by an
     * earlier run that failed is back-filled again.
     */
    private void preparePartitionColumn(String tableName, ZoneOffset dayOffset) throws SQLException {
        Optional<ColumnInfo> existing = introspector.columnInfo(tableName, PARTITION_COLUMN);
        if (existing.isPresent() && existing.get().isGenerated()) {
            logger.info("Recreating generated column {}.{} as a regular column", tableName, PARTITION_COLUMN);
            execute(tableName, "drop generated column",
                sqlGenerator.generateDropColumn(tableName, PARTITION_COLUMN));
            existing = Optional.empty();
        }

        if (existing.isEmpty()) {
            logger.info("Adding {}.{} derived from {}", tableName, PARTITION_COLUMN, sourceColumn);
            execute(tableName, "add partition column",
                sqlGenerator.generateAddDateColumn(tableName, PARTITION_COLUMN, sourceColumn));
        } else if (!existing.get().isNullable()) {
            logger.info("{}.{} already exists", tableName, PARTITION_COLUMN);
            return;
        } else {
            logger.info("{}.{} exists but is still nullable, back-filling again", tableName, PARTITION_COLUMN);
        }

        execute(tableName, "populate partition column",
            sqlGenerator.generatePopulateDateColumn(tableName, PARTITION_COLUMN, sourceColumn, dayOffset));
        execute(tableName, "make partition column NOT NULL",
            sqlGenerator.generateDateColumnNotNull(tableName, PARTITION_COLUMN));
    }

    private void ensurePartitionIndex(String tableName) throws SQLException {
        try {
            executeDdl(sqlGenerator.generateAddIndex(tableName, PARTITION_INDEX, PARTITION_COLUMN));
        } catch (SQLException e) {
            if (e.getErrorCode() != ER_DUP_KEYNAME) {
                throw migrationFailure(tableName, "add partition index", e);
            }
            logger.debug("Index {} already exists on {}", PARTITION_INDEX, tableName);
        }
    }

    private void extendPrimaryKey(String tableName) throws SQLException {
        List<String> primaryKey = introspector.primaryKeyColumns(tableName);
        if (primaryKey.isEmpty()) {
            logger.info("{} has no primary key, leaving keys as they are", tableName);
            return;
        }
        if (primaryKey.contains(PARTITION_COLUMN)) {
            logger.info("{} already in primary key of {}", PARTITION_COLUMN, tableName);
            return;
        }
        List<String> columns = new ArrayList<>(primaryKey);
        columns.add(PARTITION_COLUMN);
        logger.info("Extending primary key of {} to {}", tableName, columns);
        execute(tableName, "extend primary key", sqlGenerator.generateReplacePrimaryKey(tableName, columns));
    }

    private PartitionConfig registerConfig(PartitionConfig config) throws SQLException {
        Optional<PartitionConfig> existing = configService.findByTableName(config.getTableName());
        if (existing.isPresent()) {
            logger.info("Keeping existing partition config for {}: {}", config.getTableName(), existing.get());
            return existing.get();
        }
        return configService.createConfig(config);
    }

    private void execute(String tableName, String step, String sql) throws SQLException {
        try {
            executeDdl(sql);
        } catch (SQLException e) {
            throw migrationFailure(tableName, step, e);
        }
    }

    private void executeDdl(String sql) throws SQLException {
        logger.debug("Executing: {}", sql);
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static PartitionException migrationFailure(String tableName, String step, SQLException e) {
        logger.error("Migration of {} failed at step '{}': {}", tableName, step, e.getMessage());
        return new PartitionException("Migration of " + tableName + " failed at step '" + step + "': " + e.getMessage(),
            e.getSQLState(), e.getErrorCode(), e);
    }
}
