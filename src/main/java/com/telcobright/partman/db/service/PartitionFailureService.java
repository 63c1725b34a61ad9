package com.telcobright.partman.db.service;

import com.telcobright.partman.core.enums.FailureAction;
import com.telcobright.partman.core.enums.FailureStatus;
import com.telcobright.partman.core.exception.FailureStoreException;
import com.telcobright.partman.core.exception.NotFoundException;
import com.telcobright.partman.db.entity.PartitionFailure;
import com.telcobright.partman.db.model.FailureStats;
import com.telcobright.partman.db.repository.PartitionFailureRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Records failed partition operations and exposes them to operators.
 * One record exists per (table, partition); a repeated failure bumps its retry count
 * until the action's retry ceiling marks it DEAD.
 */
public class PartitionFailureService {

    private static final Logger logger = LoggerFactory.getLogger(PartitionFailureService.class);

    private final PartitionFailureRepository repository;
    private final Clock clock;

    public PartitionFailureService(PartitionFailureRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public PartitionFailureService(PartitionFailureRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void initialize() throws FailureStoreException {
        repository.ensureIndexes();
    }

    /**
     * Upserts the failure record for the pair.
     *
     * @param partitionDate day the partition covers, null when the name is not dated
     */
    public PartitionFailure recordFailure(String tableName, String partitionName, FailureAction action,
                                          LocalDate partitionDate, Throwable error) throws FailureStoreException {
        Optional<PartitionFailure> existing = repository.findByTableAndPartition(tableName, partitionName);
        if (existing.isPresent()) {
            return registerRepeatedFailure(existing.get(), action, error);
        }

        PartitionFailure failure = new PartitionFailure();
        failure.setTableName(tableName);
        failure.setPartitionName(partitionName);
        failure.setPartitionDate(partitionDate);
        failure.setAction(action);
        failure.setStatus(FailureStatus.PENDING);
        failure.setRetryCount(0);
        failure.setMaxRetry(action.getDefaultMaxRetry());
        applyError(failure, error);

        Optional<PartitionFailure> inserted = repository.insertIfAbsent(failure);
        if (inserted.isPresent()) {
            logger.warn("Recorded {} failure for {}.{}: {}", action, tableName, partitionName, error.getMessage());
            return inserted.get();
        }

        // Another writer inserted the pair between our read and insert
        PartitionFailure concurrent = repository.findByTableAndPartition(tableName, partitionName)
            .orElseThrow(() -> new FailureStoreException(
                "Failure record for " + tableName + "." + partitionName + " vanished after duplicate insert", null));
        return registerRepeatedFailure(concurrent, action, error);
    }

    /**
     * Marks the record as being retried now. Persisted before the retry runs so a crash
     * leaves it RETRYING with a backoff timestamp.
     */
    public PartitionFailure markRetrying(PartitionFailure failure) throws FailureStoreException {
        failure.setStatus(FailureStatus.RETRYING);
        failure.setLastRetryAt(clock.instant());
        return repository.save(failure);
    }

    public PartitionFailure markResolved(PartitionFailure failure) throws FailureStoreException {
        failure.setStatus(FailureStatus.RESOLVED);
        failure.setResolvedAt(clock.instant());
        logger.info("Resolved {} failure for {}.{} after {} retries",
            failure.getAction(), failure.getTableName(), failure.getPartitionName(), failure.getRetryCount());
        return repository.save(failure);
    }

    public PartitionFailure markRetryFailed(PartitionFailure failure, Throwable error) throws FailureStoreException {
        return registerRepeatedFailure(failure, failure.getAction(), error);
    }

    public List<PartitionFailure> getFailures(FailureStatus status) throws FailureStoreException {
        return repository.findByStatus(status);
    }

    public List<PartitionFailure> getPendingFailures() throws FailureStoreException {
        return repository.findByStatus(FailureStatus.PENDING);
    }

    public List<PartitionFailure> getDeadFailures() throws FailureStoreException {
        return repository.findByStatus(FailureStatus.DEAD);
    }

    public List<PartitionFailure> getFailuresByTable(String tableName) throws FailureStoreException {
        return repository.findByTable(tableName);
    }

    public PartitionFailure getFailure(String id) throws SQLException {
        return repository.findById(id)
            .orElseThrow(() -> new NotFoundException("Failure record not found: " + id));
    }

    /**
     * Records eligible for a retry sweep: PENDING or RETRYING and not retried within the interval.
     */
    public List<PartitionFailure> getRetryCandidates(Duration minInterval) throws FailureStoreException {
        return repository.findRetryCandidates(clock.instant().minus(minInterval));
    }

    public FailureStats getStats() throws FailureStoreException {
        return new FailureStats(
            repository.count(),
            repository.countByStatus(FailureStatus.PENDING),
            repository.countByStatus(FailureStatus.RETRYING),
            repository.countByStatus(FailureStatus.RESOLVED),
            repository.countByStatus(FailureStatus.DEAD));
    }

    /**
     * Removes resolved records older than the given age. The store also expires them on its own.
     */
    public long purgeResolved(Duration olderThan) throws FailureStoreException {
        long removed = repository.deleteResolvedBefore(clock.instant().minus(olderThan));
        if (removed > 0) {
            logger.info("Purged {} resolved failure records", removed);
        }
        return removed;
    }

    private PartitionFailure registerRepeatedFailure(PartitionFailure failure, FailureAction action, Throwable error)
            throws FailureStoreException {
        failure.setAction(action);
        failure.setRetryCount(failure.getRetryCount() + 1);
        failure.setResolvedAt(null);
        applyError(failure, error);
        if (failure.getRetryCount() >= failure.getMaxRetry()) {
            failure.setStatus(FailureStatus.DEAD);
            logger.error("{} of {}.{} failed {} times, giving up: {}", action, failure.getTableName(),
                failure.getPartitionName(), failure.getRetryCount(), error.getMessage());
        } else {
            failure.setStatus(FailureStatus.PENDING);
            logger.warn("{} of {}.{} failed again ({}/{}): {}", action, failure.getTableName(),
                failure.getPartitionName(), failure.getRetryCount(), failure.getMaxRetry(), error.getMessage());
        }
        return repository.save(failure);
    }

    private static void applyError(PartitionFailure failure, Throwable error) {
        failure.setErrorMessage(error.getMessage());
        failure.setErrorCode(errorCode(error));
        failure.setErrorStack(stackTrace(error));
    }

    static String errorCode(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException && ((SQLException) current).getErrorCode() != 0) {
                return String.valueOf(((SQLException) current).getErrorCode());
            }
            current = current.getCause();
        }
        return null;
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
