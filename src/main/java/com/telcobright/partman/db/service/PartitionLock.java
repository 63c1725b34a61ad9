package com.telcobright.partman.db.service;

import com.telcobright.partman.db.repository.PartitionConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * Per-table mutual exclusion backed by the {@code is_running} flag of the table's configuration row.
 * Holds across processes sharing the database. A process dying while holding the lock leaves it
 * set until an operator clears it.
 */
public class PartitionLock {

    private static final Logger logger = LoggerFactory.getLogger(PartitionLock.class);

    private final PartitionConfigRepository repository;

    public PartitionLock(PartitionConfigRepository repository) {
        this.repository = repository;
    }

    public boolean acquire(long configId) throws SQLException {
        boolean acquired = repository.tryAcquireLock(configId);
        logger.debug("Lock on config {} {}", configId, acquired ? "acquired" : "busy");
        return acquired;
    }

    public void release(long configId) throws SQLException {
        repository.releaseLock(configId);
        logger.debug("Lock on config {} released", configId);
    }
}
