package com.telcobright.partman.db.service;

import com.telcobright.partman.core.exception.PartitionException;
import com.telcobright.partman.db.entity.PartitionFailure;
import com.telcobright.partman.db.model.MaintenanceSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * Re-runs recorded partition failures.
 * A sweep only picks records not retried within the retry interval.
 */
public class PartitionRetryService {

    private static final Logger logger = LoggerFactory.getLogger(PartitionRetryService.class);

    private final PartitionFailureService failureService;
    private final PartitionManagementService managementService;
    private final Duration retryInterval;

    public PartitionRetryService(PartitionFailureService failureService,
                                 PartitionManagementService managementService,
                                 Duration retryInterval) {
        this.failureService = failureService;
        this.managementService = managementService;
        this.retryInterval = retryInterval;
    }

    /**
     * Retries every eligible PENDING or RETRYING record once.
     */
    public MaintenanceSummary retryFailedPartitions() throws SQLException {
        List<PartitionFailure> candidates = failureService.getRetryCandidates(retryInterval);
        MaintenanceSummary summary = MaintenanceSummary.empty();
        if (candidates.isEmpty()) {
            logger.debug("No partition failures due for retry");
            return summary;
        }

        logger.info("Retrying {} partition failures", candidates.size());
        for (PartitionFailure failure : candidates) {
            try {
                if (retry(failure)) {
                    summary.recordSuccess();
                } else {
                    summary.recordFailure(failure.getTableName() + "." + failure.getPartitionName(),
                        new PartitionException(failure.getErrorMessage()));
                }
            } catch (SQLException e) {
                // Failure store unreachable; leave the record for the next sweep
                logger.error("Could not update failure record {}", failure.getId(), e);
                summary.recordFailure(failure.getTableName() + "." + failure.getPartitionName(), e);
            }
        }
        logger.info("Retry sweep finished: {}", summary);
        return summary;
    }

    /**
     * Retries one record immediately, regardless of backoff or status.
     */
    public PartitionFailure retryById(String id) throws SQLException {
        PartitionFailure failure = failureService.getFailure(id);
        retry(failure);
        return failure;
    }

    /**
     * @return true if the operation now succeeded and the record is RESOLVED
     */
    boolean retry(PartitionFailure failure) throws SQLException {
        failureService.markRetrying(failure);
        try {
            runAction(failure);
        } catch (SQLException | RuntimeException e) {
            failureService.markRetryFailed(failure, e);
            return false;
        }
        failureService.markResolved(failure);
        return true;
    }

    private void runAction(PartitionFailure failure) throws SQLException {
        String tableName = failure.getTableName();
        String partitionName = failure.getPartitionName();
        switch (failure.getAction()) {
            case CREATE:
                if (failure.getPartitionDate() == null) {
                    throw new PartitionException("Failure record " + failure.getId() + " has no partition date");
                }
                managementService.attemptCreatePartition(tableName, failure.getPartitionDate());
                break;
            case DROP:
                if (!managementService.partitionExists(tableName, partitionName)) {
                    logger.info("Partition {}.{} is already gone", tableName, partitionName);
                    return;
                }
                managementService.attemptDropPartition(tableName, partitionName);
                break;
            case TRUNCATE:
                managementService.attemptTruncatePartition(tableName, partitionName);
                break;
            default:
                throw new IllegalStateException("Unknown failure action: " + failure.getAction());
        }
    }
}
