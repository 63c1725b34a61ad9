package com.telcobright.partman.db.repository;

import com.telcobright.partman.db.entity.PartitionConfig;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link PartitionConfig} rows.
 * All lookups by value are parameterized.
 */
public interface PartitionConfigRepository {

    /**
     * Create the backing table if it does not exist.
     */
    void ensureSchema() throws SQLException;

    /**
     * All configurations ordered by table name.
     */
    List<PartitionConfig> findAll() throws SQLException;

    /**
     * Enabled configurations ordered by table name.
     */
    List<PartitionConfig> findEnabled() throws SQLException;

    Optional<PartitionConfig> findById(long id) throws SQLException;

    Optional<PartitionConfig> findByTableName(String tableName) throws SQLException;

    /**
     * @return the stored row with its generated id
     * @throws com.telcobright.partman.core.exception.ConflictException if the table already has a row
     */
    PartitionConfig insert(PartitionConfig config) throws SQLException;

    /**
     * Writes the policy columns. The lock flag and run timestamps are left untouched.
     */
    PartitionConfig update(PartitionConfig config) throws SQLException;

    boolean delete(long id) throws SQLException;

    /**
     * Sets the running flag only if it is currently clear, in a single conditional update.
     *
     * @return true if this caller took the lock
     */
    boolean tryAcquireLock(long id) throws SQLException;

    /**
     * Clears the running flag unconditionally.
     */
    void releaseLock(long id) throws SQLException;

    void updateRunTimes(long id, Instant lastRunAt, Instant nextRunAt) throws SQLException;
}
