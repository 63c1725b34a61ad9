package com.telcobright.partman.db.connection;

import com.telcobright.partman.core.config.DataSourceConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Pooled JDBC connections to the database holding both the managed tables
 * and the {@code partition_config} table.
 */
public class ConnectionProvider implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionProvider.class);

    private final HikariDataSource dataSource;
    private final DataSourceConfig config;

    public ConnectionProvider(DataSourceConfig config) {
        this(config, 10);
    }

    public ConnectionProvider(DataSourceConfig config, int maximumPoolSize) {
        this.config = config;

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.getJdbcUrl());
        hikariConfig.setUsername(config.getUsername());
        hikariConfig.setPassword(config.getPassword());
        hikariConfig.setDriverClassName("com.mysql.cj.jdbc.Driver");
        hikariConfig.setPoolName("partition-manager-" + config.getDatabase());
        hikariConfig.setMaximumPoolSize(maximumPoolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(30_000);
        hikariConfig.setIdleTimeout(600_000);
        hikariConfig.setMaxLifetime(1_800_000);
        // Fail at first use instead of at construction when the database is down
        hikariConfig.setInitializationFailTimeout(-1);

        this.dataSource = new HikariDataSource(hikariConfig);
        logger.info("ConnectionProvider initialized for {}", config);
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public String getDatabaseName() {
        return config.getDatabase();
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            logger.info("ConnectionProvider shutdown for {}", config);
        }
    }
}
