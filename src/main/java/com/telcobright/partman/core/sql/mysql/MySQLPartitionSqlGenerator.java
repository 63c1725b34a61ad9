package com.telcobright.partman.core.sql.mysql;

import com.telcobright.partman.core.partition.PartitionDefinition;
import com.telcobright.partman.core.partition.PartitionNaming;
import com.telcobright.partman.core.sql.IdentifierValidator;

import java.time.ZoneOffset;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * MariaDB/MySQL DDL text for daily RANGE partition maintenance.
 * Every identifier passed in is validated and quoted here; callers hand over raw names.
 */
public class MySQLPartitionSqlGenerator {

    private static final String TABLE = "table name";
    private static final String PARTITION = "partition name";
    private static final String COLUMN = "column name";
    private static final String INDEX = "index name";

    // Plain day ordinal, or the legacy TO_DAYS('YYYY-MM-DD') form
    private static final Pattern BOUNDARY_VALUE = Pattern.compile("^(TO_DAYS\\('\\d{4}-\\d{2}-\\d{2}'\\)|\\d+)$");

    /**
     * Splits the MAXVALUE partition so a bounded partition can be placed in front of it.
     */
    public String generateReorganizeFuturePartition(String tableName, String partitionName, long boundary) {
        return String.format(
            "ALTER TABLE %s REORGANIZE PARTITION %s INTO (PARTITION %s VALUES LESS THAN (%d), PARTITION %s VALUES LESS THAN MAXVALUE)",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(PartitionNaming.FUTURE_PARTITION, PARTITION),
            IdentifierValidator.escape(partitionName, PARTITION),
            boundary,
            IdentifierValidator.escape(PartitionNaming.FUTURE_PARTITION, PARTITION));
    }

    public String generateAddPartition(String tableName, String partitionName, long boundary) {
        return String.format("ALTER TABLE %s ADD PARTITION (PARTITION %s VALUES LESS THAN (%d))",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(partitionName, PARTITION),
            boundary);
    }

    public String generateDropPartition(String tableName, String partitionName) {
        return String.format("ALTER TABLE %s DROP PARTITION %s",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(partitionName, PARTITION));
    }

    public String generateTruncatePartition(String tableName, String partitionName) {
        return String.format("ALTER TABLE %s TRUNCATE PARTITION %s",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(partitionName, PARTITION));
    }

    public String generateAddIndex(String tableName, String indexName, String columnName) {
        return String.format("ALTER TABLE %s ADD INDEX %s (%s)",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(indexName, INDEX),
            IdentifierValidator.escape(columnName, COLUMN));
    }

    public String generateReplacePrimaryKey(String tableName, List<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Primary key needs at least one column");
        }
        String columnList = columns.stream()
            .map(column -> IdentifierValidator.escape(column, COLUMN))
            .collect(Collectors.joining(", "));
        return String.format("ALTER TABLE %s DROP PRIMARY KEY, ADD PRIMARY KEY (%s)",
            IdentifierValidator.escape(tableName, TABLE), columnList);
    }

    /**
     * Nullable at first so existing rows can be back-filled before the NOT NULL constraint goes on.
     */
    public String generateAddDateColumn(String tableName, String columnName, String sourceColumn) {
        IdentifierValidator.validate(sourceColumn, COLUMN);
        return String.format("ALTER TABLE %s ADD COLUMN %s DATE NULL COMMENT 'Partition key based on %s'",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(columnName, COLUMN),
            sourceColumn);
    }

    /**
     * @param dayOffset see {@link #dayOf(String, ZoneOffset)}
     */
    public String generatePopulateDateColumn(String tableName, String columnName, String sourceColumn,
                                             ZoneOffset dayOffset) {
        return String.format("UPDATE %s SET %s = %s",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(columnName, COLUMN),
            dayOf(sourceColumn, dayOffset));
    }

    public String generateDateColumnNotNull(String tableName, String columnName) {
        return String.format("ALTER TABLE %s MODIFY COLUMN %s DATE NOT NULL",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(columnName, COLUMN));
    }

    public String generateDropColumn(String tableName, String columnName) {
        return String.format("ALTER TABLE %s DROP COLUMN %s",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(columnName, COLUMN));
    }

    public String generateDateRangeQuery(String tableName, String columnName, ZoneOffset dayOffset) {
        String day = dayOf(columnName, dayOffset);
        return String.format(
            "SELECT MIN(%1$s) AS earliest_date, MAX(%1$s) AS latest_date, "
                + "COUNT(*) AS actual_rows, COUNT(DISTINCT %1$s) AS unique_dates FROM %2$s",
            day, IdentifierValidator.escape(tableName, TABLE));
    }

    /**
     * Calendar day of a column value. With an offset the value is read as UTC (the session
     * zone) and shifted to that offset first, which is what a TIMESTAMP column needs.
     */
    String dayOf(String columnName, ZoneOffset dayOffset) {
        String column = IdentifierValidator.escape(columnName, COLUMN);
        if (dayOffset == null) {
            return "DATE(" + column + ")";
        }
        return String.format("DATE(CONVERT_TZ(%s, '+00:00', '%s'))", column, offsetLiteral(dayOffset));
    }

    static String offsetLiteral(ZoneOffset offset) {
        int totalMinutes = offset.getTotalSeconds() / 60;
        char sign = totalMinutes < 0 ? '-' : '+';
        int absolute = Math.abs(totalMinutes);
        return String.format("%c%02d:%02d", sign, absolute / 60, absolute % 60);
    }

    /**
     * Builds the single statement that partitions an existing table.
     * Each definition is rebuilt from its validated name and bound, whatever produced it.
     */
    public String generatePartitionByRange(String tableName, String columnName, List<PartitionDefinition> partitions) {
        if (partitions.isEmpty()) {
            throw new IllegalArgumentException("At least one partition is required");
        }
        String definitions = partitions.stream()
            .map(this::generatePartitionDefinition)
            .collect(Collectors.joining(",\n    "));
        return String.format("ALTER TABLE %s\nPARTITION BY RANGE (TO_DAYS(%s)) (\n    %s\n)",
            IdentifierValidator.escape(tableName, TABLE),
            IdentifierValidator.escape(columnName, COLUMN),
            definitions);
    }

    String generatePartitionDefinition(PartitionDefinition definition) {
        String name = IdentifierValidator.escape(definition.getName(), PARTITION);
        if (definition.isMaxValue()) {
            return "PARTITION " + name + " VALUES LESS THAN MAXVALUE";
        }
        return "PARTITION " + name + " VALUES LESS THAN (" + validateBoundaryValue(definition.getLessThan()) + ")";
    }

    /**
     * @return the trimmed value if it is a digits-only bound or {@code TO_DAYS('YYYY-MM-DD')}
     * @throws IllegalArgumentException for anything else
     */
    public static String validateBoundaryValue(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (!BOUNDARY_VALUE.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid partition value: " + value);
        }
        return trimmed;
    }
}
