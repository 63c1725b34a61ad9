package com.telcobright.partman.db.scheduler;

import com.telcobright.partman.core.exception.NotFoundException;
import com.telcobright.partman.db.entity.PartitionConfig;
import com.telcobright.partman.db.model.MaintenanceRunReport;
import com.telcobright.partman.db.model.MaintenanceSummary;
import com.telcobright.partman.db.service.PartitionConfigService;
import com.telcobright.partman.db.service.PartitionLock;
import com.telcobright.partman.db.service.PartitionManagementService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs partition maintenance for each configured table at its own time of day.
 * <p>
 * A tick fires every {@code tickInterval}; a configuration is due once its latest scheduled
 * occurrence is later than its last run. A configuration that never ran waits for its
 * scheduled time to pass between two ticks. Each due table is maintained
 * under its per-table lock: future partitions are ensured, then old ones cleaned up.
 */
public class PartitionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(PartitionScheduler.class);

    private final PartitionConfigService configService;
    private final PartitionManagementService managementService;
    private final PartitionLock lock;
    private final Executor workers;
    private final ZoneOffset zoneOffset;
    private final Duration tickInterval;
    private final boolean enabled;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private volatile Instant lastTickAt;

    public PartitionScheduler(PartitionConfigService configService, PartitionManagementService managementService,
                              PartitionLock lock, Executor workers, ZoneOffset zoneOffset,
                              Duration tickInterval, boolean enabled, Clock clock) {
        this.configService = configService;
        this.managementService = managementService;
        this.lock = lock;
        this.workers = workers;
        this.zoneOffset = zoneOffset;
        this.tickInterval = tickInterval;
        this.enabled = enabled;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "partition-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Ensures future partitions for every active table once, then starts the tick.
     * Does nothing when partition management is disabled.
     */
    public void start() {
        if (!enabled) {
            logger.info("Partition management disabled, scheduler not started");
            return;
        }
        runStartupMaintenance();

        long tickMillis = tickInterval.toMillis();
        long initialDelay = millisUntilNextMinute(clock.instant());
        scheduler.scheduleAtFixedRate(this::tick, initialDelay, tickMillis, TimeUnit.MILLISECONDS);
        logger.info("Partition scheduler started, ticking every {}s at offset {}", tickInterval.getSeconds(), zoneOffset);
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Partition scheduler stopped");
    }

    void runStartupMaintenance() {
        try {
            List<PartitionConfig> configs = configService.getActiveConfigs();
            MaintenanceSummary summary = managementService.ensureFuturePartitions(configs);
            if (summary.hasFailures()) {
                logger.error("Startup partition creation finished with failures: {} {}", summary, summary.getErrors());
            } else {
                logger.info("Startup partition creation for {} tables: {}", configs.size(), summary);
            }
        } catch (SQLException | RuntimeException e) {
            logger.error("Startup partition maintenance failed, continuing with scheduled runs", e);
        }
    }

    void tick() {
        try {
            Instant now = clock.instant();
            Duration window = tickWindow(lastTickAt, now, tickInterval);
            lastTickAt = now;
            List<PartitionConfig> due = dueConfigs(now, zoneOffset, window, configService.getActiveConfigs());
            if (due.isEmpty()) {
                return;
            }
            logger.info("{} tables due for maintenance: {}", due.size(),
                due.stream().map(PartitionConfig::getTableName).collect(Collectors.toList()));
            runAll(due).forEach(report -> logger.info("Maintenance {}", report));
        } catch (SQLException | RuntimeException e) {
            logger.error("Scheduler tick failed", e);
        }
    }

    /**
     * Runs maintenance on every active table now, ignoring scheduled times. Each table is still
     * skipped if its lock is held.
     */
    public List<MaintenanceRunReport> triggerManualMaintenance() throws SQLException {
        logger.info("Manual maintenance triggered for all tables");
        return runAll(configService.getActiveConfigs());
    }

    public MaintenanceRunReport triggerManualMaintenance(String tableName) throws SQLException {
        PartitionConfig config = configService.findByTableName(tableName)
            .orElseThrow(() -> new NotFoundException("No partition config for table " + tableName));
        logger.info("Manual maintenance triggered for {}", tableName);
        return runMaintenance(config);
    }

    /**
     * Lock, ensure, clean up, record run times, release. The lock is released whatever happens.
     */
    public MaintenanceRunReport runMaintenance(PartitionConfig config) {
        String tableName = config.getTableName();
        long id = config.getId();
        try {
            if (!lock.acquire(id)) {
                logger.info("Maintenance of {} already running, skipped", tableName);
                return MaintenanceRunReport.skipped(tableName);
            }
        } catch (SQLException e) {
            logger.error("Could not take maintenance lock for {}", tableName, e);
            return MaintenanceRunReport.failed(tableName, e);
        }

        try {
            Instant startedAt = clock.instant();
            MaintenanceSummary creation = managementService.ensureFuturePartitions(config);
            MaintenanceSummary cleanup = managementService.cleanupOldPartitions(config);
            configService.recordRun(id, startedAt, nextRunAt(config, startedAt, zoneOffset));
            return MaintenanceRunReport.completed(tableName, creation, cleanup);
        } catch (SQLException | RuntimeException e) {
            logger.error("Maintenance of {} failed", tableName, e);
            return MaintenanceRunReport.failed(tableName, e);
        } finally {
            try {
                lock.release(id);
            } catch (SQLException e) {
                logger.error("Failed to release maintenance lock for {}; clear it manually", tableName, e);
            }
        }
    }

    private List<MaintenanceRunReport> runAll(List<PartitionConfig> configs) {
        List<CompletableFuture<MaintenanceRunReport>> futures = configs.stream()
            .map(config -> CompletableFuture.supplyAsync(() -> runMaintenance(config), workers))
            .collect(Collectors.toList());
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    /**
     * Span covered by this tick: back to the previous tick when a slow run delayed it,
     * never shorter than one interval.
     */
    static Duration tickWindow(Instant previousTick, Instant now, Duration tickInterval) {
        if (previousTick == null) {
            return tickInterval;
        }
        Duration sincePrevious = Duration.between(previousTick, now);
        return sincePrevious.compareTo(tickInterval) > 0 ? sincePrevious : tickInterval;
    }

    /**
     * Enabled configurations that have not run since their latest scheduled occurrence.
     * One that never ran is due only when that occurrence lies in {@code (now - window, now]}.
     */
    public static List<PartitionConfig> dueConfigs(Instant now, ZoneOffset zoneOffset, Duration window,
                                                   List<PartitionConfig> configs) {
        return configs.stream()
            .filter(PartitionConfig::isEnabled)
            .filter(config -> {
                Instant occurrence = latestOccurrence(config, now, zoneOffset);
                if (config.getLastRunAt() == null) {
                    return occurrence.isAfter(now.minus(window));
                }
                return config.getLastRunAt().isBefore(occurrence);
            })
            .collect(Collectors.toList());
    }

    /**
     * Most recent occurrence of the scheduled time at or before {@code now}.
     */
    static Instant latestOccurrence(PartitionConfig config, Instant now, ZoneOffset zoneOffset) {
        LocalDate today = LocalDate.ofInstant(now, zoneOffset);
        Instant occurrence = today.atTime(config.getScheduledTime()).toInstant(zoneOffset);
        return occurrence.isAfter(now) ? occurrence.minus(1, ChronoUnit.DAYS) : occurrence;
    }

    /**
     * Next occurrence of the configuration's scheduled time strictly after {@code after}.
     */
    public static Instant nextRunAt(PartitionConfig config, Instant after, ZoneOffset zoneOffset) {
        LocalDateTime local = LocalDateTime.ofInstant(after, zoneOffset);
        LocalDateTime next = local.toLocalDate().atTime(config.getScheduledTime());
        if (!next.isAfter(local)) {
            next = next.plusDays(1);
        }
        return next.toInstant(zoneOffset);
    }

    private static long millisUntilNextMinute(Instant now) {
        Instant nextMinute = now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        return Duration.between(now, nextMinute).toMillis();
    }
}
