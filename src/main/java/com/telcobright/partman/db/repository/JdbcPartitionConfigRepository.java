package com.telcobright.partman.db.repository;

import com.telcobright.partman.core.enums.CleanupAction;
import com.telcobright.partman.core.exception.ConflictException;
import com.telcobright.partman.db.entity.PartitionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link PartitionConfigRepository} over the {@code partition_config} table.
 */
public class JdbcPartitionConfigRepository implements PartitionConfigRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcPartitionConfigRepository.class);

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private static final String CREATE_TABLE_SQL = """
        CREATE TABLE IF NOT EXISTS partition_config (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            table_name VARCHAR(64) NOT NULL,
            retention_days INT NOT NULL DEFAULT 30,
            pre_create_days INT NOT NULL DEFAULT 7,
            cleanup_action ENUM('DROP', 'TRUNCATE') NOT NULL DEFAULT 'DROP',
            enabled BOOLEAN NOT NULL DEFAULT TRUE,
            scheduled_time VARCHAR(5) NOT NULL DEFAULT '00:00',
            last_run_at TIMESTAMP NULL DEFAULT NULL,
            next_run_at TIMESTAMP NULL DEFAULT NULL,
            is_running BOOLEAN NOT NULL DEFAULT FALSE,
            created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
            updated_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP,
            UNIQUE KEY uk_partition_config_table_name (table_name)
        ) ENGINE=InnoDB
        """;

    private static final String SELECT_COLUMNS = """
        SELECT id, table_name, retention_days, pre_create_days, cleanup_action, enabled,
               scheduled_time, last_run_at, next_run_at, is_running, created_at, updated_at
        FROM partition_config
        """;

    private static final String INSERT_SQL = """
        INSERT INTO partition_config
            (table_name, retention_days, pre_create_days, cleanup_action, enabled, scheduled_time)
        VALUES (?, ?, ?, ?, ?, ?)
        """;

    private static final String UPDATE_SQL = """
        UPDATE partition_config
        SET table_name = ?, retention_days = ?, pre_create_days = ?, cleanup_action = ?,
            enabled = ?, scheduled_time = ?
        WHERE id = ?
        """;

    private static final String ACQUIRE_LOCK_SQL =
        "UPDATE partition_config SET is_running = TRUE WHERE id = ? AND is_running = FALSE";

    private static final String RELEASE_LOCK_SQL =
        "UPDATE partition_config SET is_running = FALSE WHERE id = ?";

    private static final String UPDATE_RUN_TIMES_SQL =
        "UPDATE partition_config SET last_run_at = ?, next_run_at = ? WHERE id = ?";

    private final DataSource dataSource;

    public JdbcPartitionConfigRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void ensureSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            logger.debug("partition_config table ensured");
        }
    }

    @Override
    public List<PartitionConfig> findAll() throws SQLException {
        return query(SELECT_COLUMNS + " ORDER BY table_name");
    }

    @Override
    public List<PartitionConfig> findEnabled() throws SQLException {
        return query(SELECT_COLUMNS + " WHERE enabled = TRUE ORDER BY table_name");
    }

    @Override
    public Optional<PartitionConfig> findById(long id) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
            stmt.setLong(1, id);
            return querySingle(stmt);
        }
    }

    @Override
    public Optional<PartitionConfig> findByTableName(String tableName) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS + " WHERE table_name = ?")) {
            stmt.setString(1, tableName);
            return querySingle(stmt);
        }
    }

    @Override
    public PartitionConfig insert(PartitionConfig config) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            bindPolicy(stmt, config);
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (keys.next()) {
                    config.setId(keys.getLong(1));
                }
            }
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new ConflictException("Partition config for table " + config.getTableName() + " already exists");
        }
        logger.info("Inserted partition config for {} (id={})", config.getTableName(), config.getId());
        return findById(config.getId()).orElse(config);
    }

    @Override
    public PartitionConfig update(PartitionConfig config) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            bindPolicy(stmt, config);
            stmt.setLong(7, config.getId());
            stmt.executeUpdate();
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new ConflictException("Partition config for table " + config.getTableName() + " already exists");
        }
        return findById(config.getId()).orElse(config);
    }

    @Override
    public boolean delete(long id) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("DELETE FROM partition_config WHERE id = ?")) {
            stmt.setLong(1, id);
            return stmt.executeUpdate() > 0;
        }
    }

    @Override
    public boolean tryAcquireLock(long id) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(ACQUIRE_LOCK_SQL)) {
            stmt.setLong(1, id);
            return stmt.executeUpdate() == 1;
        }
    }

    @Override
    public void releaseLock(long id) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(RELEASE_LOCK_SQL)) {
            stmt.setLong(1, id);
            stmt.executeUpdate();
        }
    }

    @Override
    public void updateRunTimes(long id, Instant lastRunAt, Instant nextRunAt) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_RUN_TIMES_SQL)) {
            stmt.setTimestamp(1, toTimestamp(lastRunAt));
            stmt.setTimestamp(2, toTimestamp(nextRunAt));
            stmt.setLong(3, id);
            stmt.executeUpdate();
        }
    }

    private List<PartitionConfig> query(String sql) throws SQLException {
        List<PartitionConfig> configs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                configs.add(mapRow(rs));
            }
        }
        return configs;
    }

    private Optional<PartitionConfig> querySingle(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
        }
    }

    private void bindPolicy(PreparedStatement stmt, PartitionConfig config) throws SQLException {
        stmt.setString(1, config.getTableName());
        stmt.setInt(2, config.getRetentionDays());
        stmt.setInt(3, config.getPreCreateDays());
        stmt.setString(4, config.getCleanupAction().name());
        stmt.setBoolean(5, config.isEnabled());
        stmt.setString(6, config.getScheduledTime().format(TIME_FORMAT));
    }

    private PartitionConfig mapRow(ResultSet rs) throws SQLException {
        PartitionConfig config = new PartitionConfig();
        config.setId(rs.getLong("id"));
        config.setTableName(rs.getString("table_name"));
        config.setRetentionDays(rs.getInt("retention_days"));
        config.setPreCreateDays(rs.getInt("pre_create_days"));
        config.setCleanupAction(CleanupAction.valueOf(rs.getString("cleanup_action")));
        config.setEnabled(rs.getBoolean("enabled"));
        config.setScheduledTime(LocalTime.parse(rs.getString("scheduled_time"), TIME_FORMAT));
        config.setLastRunAt(toInstant(rs.getTimestamp("last_run_at")));
        config.setNextRunAt(toInstant(rs.getTimestamp("next_run_at")));
        config.setRunning(rs.getBoolean("is_running"));
        config.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        config.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
        return config;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
