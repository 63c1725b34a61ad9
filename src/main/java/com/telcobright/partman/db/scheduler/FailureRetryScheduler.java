package com.telcobright.partman.db.scheduler;

import com.telcobright.partman.db.model.MaintenanceSummary;
import com.telcobright.partman.db.service.PartitionRetryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic retry sweep over recorded partition failures.
 */
public class FailureRetryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(FailureRetryScheduler.class);

    private final PartitionRetryService retryService;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public FailureRetryScheduler(PartitionRetryService retryService, Duration interval) {
        this.retryService = retryService;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "partition-retry");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        long period = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, period, period, TimeUnit.MILLISECONDS);
        logger.info("Failure retry sweep scheduled every {} minutes", interval.toMinutes());
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
        logger.info("Failure retry sweep stopped");
    }

    void sweep() {
        try {
            MaintenanceSummary summary = retryService.retryFailedPartitions();
            if (summary.hasFailures()) {
                logger.warn("Retry sweep left {} failures unresolved", summary.getFailed());
            }
        } catch (SQLException | RuntimeException e) {
            logger.error("Retry sweep failed", e);
        }
    }
}
