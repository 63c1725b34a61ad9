package com.telcobright.partman.db.metadata;

import com.telcobright.partman.core.sql.mysql.MySQLPartitionSqlGenerator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries against the engine's metadata catalog for the current schema.
 * All catalog lookups bind names as statement parameters; engine errors propagate unchanged.
 */
public class SchemaIntrospector {

    private static final String TABLE_EXISTS_SQL = """
        SELECT COUNT(*) AS table_count
        FROM information_schema.tables
        WHERE table_schema = DATABASE()
        AND table_name = ?
        """;

    private static final String TABLE_STATS_SQL = """
        SELECT table_rows, data_length, index_length
        FROM information_schema.tables
        WHERE table_schema = DATABASE()
        AND table_name = ?
        """;

    private static final String COLUMN_INFO_SQL = """
        SELECT column_name, data_type, column_type, is_nullable, generation_expression
        FROM information_schema.columns
        WHERE table_schema = DATABASE()
        AND table_name = ?
        AND column_name = ?
        """;

    private static final String PRIMARY_KEY_SQL = """
        SELECT column_name
        FROM information_schema.key_column_usage
        WHERE table_schema = DATABASE()
        AND table_name = ?
        AND constraint_name = 'PRIMARY'
        ORDER BY ordinal_position
        """;

    private static final String LIST_PARTITIONS_SQL = """
        SELECT partition_name, partition_description, table_rows, data_length, create_time
        FROM information_schema.partitions
        WHERE table_schema = DATABASE()
        AND table_name = ?
        AND partition_name IS NOT NULL
        ORDER BY partition_name
        """;

    private static final String PARTITION_EXISTS_SQL = """
        SELECT COUNT(*) AS partition_count
        FROM information_schema.partitions
        WHERE table_schema = DATABASE()
        AND table_name = ?
        AND partition_name = ?
        """;

    private final DataSource dataSource;
    private final MySQLPartitionSqlGenerator sqlGenerator;

    public SchemaIntrospector(DataSource dataSource) {
        this(dataSource, new MySQLPartitionSqlGenerator());
    }

    public SchemaIntrospector(DataSource dataSource, MySQLPartitionSqlGenerator sqlGenerator) {
        this.dataSource = dataSource;
        this.sqlGenerator = sqlGenerator;
    }

    public boolean tableExists(String tableName) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(TABLE_EXISTS_SQL)) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getLong("table_count") > 0;
            }
        }
    }

    public Optional<TableStats> tableStats(String tableName) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(TABLE_STATS_SQL)) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new TableStats(
                    rs.getLong("table_rows"),
                    rs.getLong("data_length"),
                    rs.getLong("index_length")));
            }
        }
    }

    public Optional<ColumnInfo> columnInfo(String tableName, String columnName) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COLUMN_INFO_SQL)) {
            stmt.setString(1, tableName);
            stmt.setString(2, columnName);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ColumnInfo(
                    rs.getString("column_name"),
                    rs.getString("data_type"),
                    rs.getString("column_type"),
                    "YES".equalsIgnoreCase(rs.getString("is_nullable")),
                    rs.getString("generation_expression")));
            }
        }
    }

    public List<String> primaryKeyColumns(String tableName) throws SQLException {
        List<String> columns = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(PRIMARY_KEY_SQL)) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    columns.add(rs.getString("column_name"));
                }
            }
        }
        return columns;
    }

    /**
     * Partitions of the table ordered by name; empty when the table is not partitioned.
     */
    public List<PartitionInfo> listPartitions(String tableName) throws SQLException {
        List<PartitionInfo> partitions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(LIST_PARTITIONS_SQL)) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Timestamp createTime = rs.getTimestamp("create_time");
                    partitions.add(new PartitionInfo(
                        rs.getString("partition_name"),
                        rs.getString("partition_description"),
                        rs.getLong("table_rows"),
                        rs.getLong("data_length"),
                        createTime != null ? createTime.toLocalDateTime() : null));
                }
            }
        }
        return partitions;
    }

    public boolean partitionExists(String tableName, String partitionName) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(PARTITION_EXISTS_SQL)) {
            stmt.setString(1, tableName);
            stmt.setString(2, partitionName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getLong("partition_count") > 0;
            }
        }
    }

    public boolean isPartitioned(String tableName) throws SQLException {
        return !listPartitions(tableName).isEmpty();
    }

    /**
     * Day span of the column. Table and column names are validated and quoted by the SQL generator.
     *
     * @param dayOffset offset the column's values are shifted to before taking the day, or
     *                  {@code null} to take the day of the stored value as is
     */
    public DateRange dateRange(String tableName, String columnName, ZoneOffset dayOffset) throws SQLException {
        String sql = sqlGenerator.generateDateRangeQuery(tableName, columnName, dayOffset);
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            if (!rs.next()) {
                return new DateRange(null, null, 0, 0);
            }
            Date earliest = rs.getDate("earliest_date");
            Date latest = rs.getDate("latest_date");
            return new DateRange(
                earliest != null ? earliest.toLocalDate() : null,
                latest != null ? latest.toLocalDate() : null,
                rs.getLong("actual_rows"),
                rs.getLong("unique_dates"));
        }
    }
}
