package com.telcobright.partman.db.repository;

import com.telcobright.partman.core.enums.FailureStatus;
import com.telcobright.partman.core.exception.FailureStoreException;
import com.telcobright.partman.db.entity.PartitionFailure;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link PartitionFailure} records, kept apart from the relational engine
 * so failures can be recorded while that engine is unreachable.
 * (tableName, partitionName) is unique.
 */
public interface PartitionFailureRepository {

    void ensureIndexes() throws FailureStoreException;

    Optional<PartitionFailure> findById(String id) throws FailureStoreException;

    Optional<PartitionFailure> findByTableAndPartition(String tableName, String partitionName) throws FailureStoreException;

    /**
     * Inserts the record unless one already exists for its (table, partition) pair.
     *
     * @return the stored record, or empty if the pair is already present
     */
    Optional<PartitionFailure> insertIfAbsent(PartitionFailure failure) throws FailureStoreException;

    /**
     * Replaces the stored record with the same id and refreshes its {@code updatedAt}.
     */
    PartitionFailure save(PartitionFailure failure) throws FailureStoreException;

    /**
     * Newest first. A null status returns every record.
     */
    List<PartitionFailure> findByStatus(FailureStatus status) throws FailureStoreException;

    /**
     * Newest first.
     */
    List<PartitionFailure> findByTable(String tableName) throws FailureStoreException;

    /**
     * PENDING or RETRYING records never retried, or last retried before {@code retriedBefore}.
     */
    List<PartitionFailure> findRetryCandidates(Instant retriedBefore) throws FailureStoreException;

    long countByStatus(FailureStatus status) throws FailureStoreException;

    long count() throws FailureStoreException;

    /**
     * Removes RESOLVED records resolved before the cutoff.
     *
     * @return number of removed records
     */
    long deleteResolvedBefore(Instant cutoff) throws FailureStoreException;
}
