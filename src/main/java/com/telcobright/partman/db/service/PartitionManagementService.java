package com.telcobright.partman.db.service;

import com.telcobright.partman.core.enums.CleanupAction;
import com.telcobright.partman.core.enums.FailureAction;
import com.telcobright.partman.core.exception.NotFoundException;
import com.telcobright.partman.core.exception.PartitionDdlException;
import com.telcobright.partman.core.exception.PartitionException;
import com.telcobright.partman.core.partition.PartitionNaming;
import com.telcobright.partman.core.sql.IdentifierValidator;
import com.telcobright.partman.core.sql.mysql.MySQLPartitionSqlGenerator;
import com.telcobright.partman.db.entity.PartitionConfig;
import com.telcobright.partman.db.metadata.PartitionInfo;
import com.telcobright.partman.db.metadata.SchemaIntrospector;
import com.telcobright.partman.db.model.MaintenanceSummary;
import com.telcobright.partman.db.model.PartitionCoverage;
import com.telcobright.partman.db.model.PartitionOperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Creates, drops and truncates daily partitions on managed tables.
 * <p>
 * Operations on one table run sequentially because each creation may reorganize
 * {@code p_future}; batches fan out across tables on the worker executor.
 * Failed DDL is recorded with the {@link PartitionFailureService} before it reaches the caller.
 */
public class PartitionManagementService {

    private static final Logger logger = LoggerFactory.getLogger(PartitionManagementService.class);

    static final int ER_SAME_NAME_PARTITION = 1517;

    private final DataSource dataSource;
    private final SchemaIntrospector introspector;
    private final MySQLPartitionSqlGenerator sqlGenerator;
    private final PartitionNaming naming;
    private final PartitionFailureService failureService;
    private final Executor workers;
    private final Clock clock;

    public PartitionManagementService(DataSource dataSource, SchemaIntrospector introspector,
                                      MySQLPartitionSqlGenerator sqlGenerator, PartitionNaming naming,
                                      PartitionFailureService failureService, Executor workers, Clock clock) {
        this.dataSource = dataSource;
        this.introspector = introspector;
        this.sqlGenerator = sqlGenerator;
        this.naming = naming;
        this.failureService = failureService;
        this.workers = workers;
        this.clock = clock;
    }

    public LocalDate today() {
        return naming.today(clock);
    }

    /**
     * Creates the partition for {@code date}. An already existing partition is not an error.
     *
     * @return true if the partition was created by this call
     * @throws NotFoundException if the table does not exist
     * @throws PartitionDdlException if the engine rejects the DDL; the failure has been recorded
     */
    public boolean createPartition(String tableName, LocalDate date) throws SQLException {
        requireTable(tableName);
        try {
            return attemptCreatePartition(tableName, date);
        } catch (SQLException e) {
            throw recordAndWrap(tableName, naming.partitionName(date), FailureAction.CREATE, date, e);
        }
    }

    /**
     * Same as {@link #createPartition} without recording a failure. Used when retrying a recorded one.
     */
    public boolean attemptCreatePartition(String tableName, LocalDate date) throws SQLException {
        requireTable(tableName);
        String partitionName = naming.partitionName(date);
        long boundary = naming.boundaryValue(date);

        String sql = introspector.partitionExists(tableName, PartitionNaming.FUTURE_PARTITION)
            ? sqlGenerator.generateReorganizeFuturePartition(tableName, partitionName, boundary)
            : sqlGenerator.generateAddPartition(tableName, partitionName, boundary);
        try {
            executeDdl(sql);
            logger.info("Created partition {}.{} (< {})", tableName, partitionName, boundary);
            return true;
        } catch (SQLException e) {
            if (isDuplicatePartition(e)) {
                logger.debug("Partition {}.{} already exists", tableName, partitionName);
                return false;
            }
            throw e;
        }
    }

    public PartitionOperationResult dropPartition(String tableName, String partitionName) throws SQLException {
        try {
            return attemptDropPartition(tableName, partitionName);
        } catch (SQLException e) {
            throw recordAndWrap(tableName, partitionName, FailureAction.DROP, datePart(partitionName), e);
        }
    }

    public PartitionOperationResult attemptDropPartition(String tableName, String partitionName) throws SQLException {
        executeDdl(sqlGenerator.generateDropPartition(tableName, partitionName));
        logger.warn("Dropped partition {}.{}", tableName, partitionName);
        return new PartitionOperationResult(true, "Partition " + partitionName + " dropped from " + tableName);
    }

    public PartitionOperationResult truncatePartition(String tableName, String partitionName) throws SQLException {
        try {
            return attemptTruncatePartition(tableName, partitionName);
        } catch (SQLException e) {
            throw recordAndWrap(tableName, partitionName, FailureAction.TRUNCATE, datePart(partitionName), e);
        }
    }

    public PartitionOperationResult attemptTruncatePartition(String tableName, String partitionName) throws SQLException {
        executeDdl(sqlGenerator.generateTruncatePartition(tableName, partitionName));
        logger.info("Truncated partition {}.{}", tableName, partitionName);
        return new PartitionOperationResult(true, "Partition " + partitionName + " truncated on " + tableName);
    }

    public PartitionOperationResult dropPartitionByDate(String tableName, LocalDate date) throws SQLException {
        return dropPartition(tableName, naming.partitionName(date));
    }

    public PartitionOperationResult truncatePartitionByDate(String tableName, LocalDate date) throws SQLException {
        return truncatePartition(tableName, naming.partitionName(date));
    }

    public boolean partitionExists(String tableName, LocalDate date) throws SQLException {
        IdentifierValidator.validate(tableName, "table name");
        return introspector.partitionExists(tableName, naming.partitionName(date));
    }

    public boolean partitionExists(String tableName, String partitionName) throws SQLException {
        IdentifierValidator.validate(tableName, "table name");
        IdentifierValidator.validate(partitionName, "partition name");
        return introspector.partitionExists(tableName, partitionName);
    }

    public List<PartitionInfo> listPartitions(String tableName) throws SQLException {
        requireTable(tableName);
        return introspector.listPartitions(tableName);
    }

    public PartitionCoverage getCoverage(String tableName) throws SQLException {
        List<PartitionInfo> partitions = listPartitions(tableName);
        List<String> dated = partitions.stream()
            .map(PartitionInfo::getName)
            .filter(PartitionNaming::isDatedPartition)
            .sorted()
            .collect(Collectors.toList());
        boolean hasFuture = partitions.stream().anyMatch(PartitionInfo::isFuturePartition);
        return new PartitionCoverage(tableName,
            dated.isEmpty() ? null : dated.get(0),
            dated.isEmpty() ? null : dated.get(dated.size() - 1),
            dated.size(),
            hasFuture);
    }

    /**
     * Makes sure partitions exist for today through today + preCreateDays on every enabled table.
     */
    public MaintenanceSummary ensureFuturePartitions(List<PartitionConfig> configs) {
        return fanOut(configs, this::ensureFuturePartitions);
    }

    public MaintenanceSummary ensureFuturePartitions(PartitionConfig config) {
        MaintenanceSummary summary = MaintenanceSummary.empty();
        String tableName = config.getTableName();
        LocalDate today = today();
        try {
            requireTable(tableName);
        } catch (SQLException e) {
            logger.warn("Skipping partition creation for {}: {}", tableName, e.getMessage());
            summary.recordFailure(tableName, e);
            return summary;
        }

        for (int i = 0; i <= config.getPreCreateDays(); i++) {
            LocalDate date = today.plusDays(i);
            String partitionName = naming.partitionName(date);
            try {
                if (introspector.partitionExists(tableName, partitionName)) {
                    summary.recordSkipped();
                } else if (attemptCreatePartition(tableName, date)) {
                    summary.recordSuccess();
                } else {
                    summary.recordSkipped();
                }
            } catch (SQLException e) {
                summary.recordFailure(tableName + "." + partitionName, e);
                recordQuietly(tableName, partitionName, FailureAction.CREATE, date, e);
            }
        }
        logger.info("Ensured future partitions for {}: {}", tableName, summary);
        return summary;
    }

    /**
     * Applies each enabled table's cleanup action to its partitions at or before today - retentionDays.
     */
    public MaintenanceSummary cleanupOldPartitions(List<PartitionConfig> configs) {
        return fanOut(configs, this::cleanupOldPartitions);
    }

    public MaintenanceSummary cleanupOldPartitions(PartitionConfig config) {
        MaintenanceSummary summary = MaintenanceSummary.empty();
        String tableName = config.getTableName();
        LocalDate cutoff = today().minusDays(config.getRetentionDays());
        CleanupAction cleanupAction = config.getCleanupAction();
        FailureAction failureAction = FailureAction.forCleanup(cleanupAction);

        List<String> expired;
        try {
            expired = selectPartitionsForCleanup(introspector.listPartitions(tableName), naming.partitionName(cutoff));
        } catch (SQLException e) {
            logger.error("Failed to list partitions of {} for cleanup", tableName, e);
            summary.recordFailure(tableName, e);
            return summary;
        }

        for (String partitionName : expired) {
            try {
                if (cleanupAction == CleanupAction.TRUNCATE) {
                    attemptTruncatePartition(tableName, partitionName);
                } else {
                    attemptDropPartition(tableName, partitionName);
                }
                summary.recordSuccess();
            } catch (SQLException e) {
                summary.recordFailure(tableName + "." + partitionName, e);
                recordQuietly(tableName, partitionName, failureAction, datePart(partitionName), e);
            }
        }
        logger.info("Cleaned up {} partitions of {} up to {}: {}", cleanupAction, tableName,
            naming.partitionName(cutoff), summary);
        return summary;
    }

    /**
     * Dated partitions whose name sorts at or before the cutoff name. {@code p_future} and
     * other undated partitions are never selected.
     */
    public static List<String> selectPartitionsForCleanup(List<PartitionInfo> partitions, String cutoffPartitionName) {
        return partitions.stream()
            .map(PartitionInfo::getName)
            .filter(PartitionNaming::isDatedPartition)
            .filter(name -> name.compareTo(cutoffPartitionName) <= 0)
            .sorted()
            .collect(Collectors.toList());
    }

    static boolean isDuplicatePartition(SQLException e) {
        if (e.getErrorCode() == ER_SAME_NAME_PARTITION) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("duplicate partition");
    }

    private MaintenanceSummary fanOut(List<PartitionConfig> configs, Function<PartitionConfig, MaintenanceSummary> perTable) {
        List<CompletableFuture<MaintenanceSummary>> futures = configs.stream()
            .filter(PartitionConfig::isEnabled)
            .map(config -> CompletableFuture.supplyAsync(() -> isolate(config, perTable), workers))
            .collect(Collectors.toList());

        return futures.stream()
            .map(CompletableFuture::join)
            .reduce(MaintenanceSummary.empty(), MaintenanceSummary::merge);
    }

    private MaintenanceSummary isolate(PartitionConfig config, Function<PartitionConfig, MaintenanceSummary> perTable) {
        try {
            return perTable.apply(config);
        } catch (RuntimeException e) {
            logger.error("Maintenance of {} aborted", config.getTableName(), e);
            MaintenanceSummary summary = MaintenanceSummary.empty();
            summary.recordFailure(config.getTableName(), e);
            return summary;
        }
    }

    private void requireTable(String tableName) throws SQLException {
        IdentifierValidator.validate(tableName, "table name");
        if (!introspector.tableExists(tableName)) {
            throw new NotFoundException("Table not found: " + tableName);
        }
    }

    private void executeDdl(String sql) throws SQLException {
        logger.debug("Executing: {}", sql);
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private SQLException recordAndWrap(String tableName, String partitionName, FailureAction action,
                                       LocalDate date, SQLException error) {
        SQLException wrapped = error instanceof PartitionException
            ? error
            : new PartitionDdlException(tableName, partitionName, error);
        recordQuietly(tableName, partitionName, action, date, wrapped);
        return wrapped;
    }

    /**
     * Records the failure; if the failure store is itself unavailable the store error is
     * attached to {@code error} as suppressed and logged.
     */
    private void recordQuietly(String tableName, String partitionName, FailureAction action,
                               LocalDate date, SQLException error) {
        logger.error("{} of {}.{} failed: {}", action, tableName, partitionName, error.getMessage());
        try {
            failureService.recordFailure(tableName, partitionName, action, date, error);
        } catch (SQLException storeError) {
            error.addSuppressed(storeError);
            logger.error("Could not record {} failure for {}.{}", action, tableName, partitionName, storeError);
        }
    }

    private static LocalDate datePart(String partitionName) {
        return PartitionNaming.isDatedPartition(partitionName) ? PartitionNaming.parsePartitionDate(partitionName) : null;
    }
}
