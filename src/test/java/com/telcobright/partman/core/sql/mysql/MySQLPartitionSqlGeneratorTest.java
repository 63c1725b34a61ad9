package com.telcobright.partman.core.sql.mysql;

import com.telcobright.partman.core.partition.PartitionDefinition;
import com.telcobright.partman.core.sql.InvalidIdentifierException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MySQLPartitionSqlGenerator Tests")
class MySQLPartitionSqlGeneratorTest {

    private final MySQLPartitionSqlGenerator generator = new MySQLPartitionSqlGenerator();

    @Test
    @DisplayName("Should split p_future when adding in front of MAXVALUE")
    void testReorganizeFuturePartition() {
        String sql = generator.generateReorganizeFuturePartition("event_logs", "p_20250615", 739783L);

        assertThat(sql).isEqualTo("ALTER TABLE `event_logs` REORGANIZE PARTITION `p_future` INTO ("
            + "PARTITION `p_20250615` VALUES LESS THAN (739783), "
            + "PARTITION `p_future` VALUES LESS THAN MAXVALUE)");
    }

    @Test
    @DisplayName("Should add a partition when there is no MAXVALUE partition")
    void testAddPartition() {
        assertThat(generator.generateAddPartition("event_logs", "p_20250615", 739783L))
            .isEqualTo("ALTER TABLE `event_logs` ADD PARTITION (PARTITION `p_20250615` VALUES LESS THAN (739783))");
    }

    @Test
    @DisplayName("Should quote names in drop and truncate")
    void testDropAndTruncate() {
        assertThat(generator.generateDropPartition("event_logs", "p_20250101"))
            .isEqualTo("ALTER TABLE `event_logs` DROP PARTITION `p_20250101`");
        assertThat(generator.generateTruncatePartition("event_logs", "p_20250101"))
            .isEqualTo("ALTER TABLE `event_logs` TRUNCATE PARTITION `p_20250101`");
    }

    @Test
    @DisplayName("Should reject hostile identifiers in every statement")
    void testRejectsHostileIdentifiers() {
        String hostile = "users'; DROP TABLE users; --";

        assertThatThrownBy(() -> generator.generateDropPartition(hostile, "p_20250101"))
            .isInstanceOf(InvalidIdentifierException.class);
        assertThatThrownBy(() -> generator.generateAddPartition("users", hostile, 1L))
            .isInstanceOf(InvalidIdentifierException.class);
        assertThatThrownBy(() -> generator.generateDateRangeQuery("users", hostile, null))
            .isInstanceOf(InvalidIdentifierException.class);
        assertThatThrownBy(() -> generator.generateAddDateColumn("users", "partition_date", hostile))
            .isInstanceOf(InvalidIdentifierException.class);
    }

    @Test
    @DisplayName("Should build the full partition list in one statement")
    void testPartitionByRange() {
        String sql = generator.generatePartitionByRange("users", "partition_date", List.of(
            PartitionDefinition.lessThan("p_20250101", 739618L),
            PartitionDefinition.lessThan("p_20250102", "TO_DAYS('2025-01-03')"),
            PartitionDefinition.maxValue("p_future")));

        assertThat(sql).isEqualTo("ALTER TABLE `users`\n"
            + "PARTITION BY RANGE (TO_DAYS(`partition_date`)) (\n"
            + "    PARTITION `p_20250101` VALUES LESS THAN (739618),\n"
            + "    PARTITION `p_20250102` VALUES LESS THAN (TO_DAYS('2025-01-03')),\n"
            + "    PARTITION `p_future` VALUES LESS THAN MAXVALUE\n"
            + ")");
    }

    @Test
    @DisplayName("Should refuse boundary expressions other than digits or TO_DAYS of a date")
    void testBoundaryValidation() {
        assertThat(MySQLPartitionSqlGenerator.validateBoundaryValue(" 739618 ")).isEqualTo("739618");
        assertThat(MySQLPartitionSqlGenerator.validateBoundaryValue("TO_DAYS('2025-01-03')"))
            .isEqualTo("TO_DAYS('2025-01-03')");

        assertThatThrownBy(() -> MySQLPartitionSqlGenerator.validateBoundaryValue("1); DROP TABLE users; --"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Invalid partition value: ");
        assertThatThrownBy(() -> generator.generatePartitionByRange("users", "partition_date",
            List.of(PartitionDefinition.lessThan("p_20250101", "NOW()"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should generate migration column and key statements")
    void testMigrationStatements() {
        assertThat(generator.generateAddDateColumn("users", "partition_date", "updatedDate"))
            .isEqualTo("ALTER TABLE `users` ADD COLUMN `partition_date` DATE NULL COMMENT 'Partition key based on updatedDate'");
        assertThat(generator.generatePopulateDateColumn("users", "partition_date", "updatedDate", null))
            .isEqualTo("UPDATE `users` SET `partition_date` = DATE(`updatedDate`)");
        assertThat(generator.generateDateColumnNotNull("users", "partition_date"))
            .isEqualTo("ALTER TABLE `users` MODIFY COLUMN `partition_date` DATE NOT NULL");
        assertThat(generator.generateAddIndex("users", "idx_partition_date", "partition_date"))
            .isEqualTo("ALTER TABLE `users` ADD INDEX `idx_partition_date` (`partition_date`)");
        assertThat(generator.generateReplacePrimaryKey("users", List.of("id", "partition_date")))
            .isEqualTo("ALTER TABLE `users` DROP PRIMARY KEY, ADD PRIMARY KEY (`id`, `partition_date`)");
    }

    @Test
    @DisplayName("Should shift TIMESTAMP values to the partition offset before taking the day")
    void testDayAtOffset() {
        assertThat(generator.generatePopulateDateColumn("users", "partition_date", "createdAt", ZoneOffset.ofHours(8)))
            .isEqualTo("UPDATE `users` SET `partition_date` = DATE(CONVERT_TZ(`createdAt`, '+00:00', '+08:00'))");
        assertThat(generator.generateDateRangeQuery("users", "createdAt", ZoneOffset.ofHoursMinutes(-3, -30)))
            .startsWith("SELECT MIN(DATE(CONVERT_TZ(`createdAt`, '+00:00', '-03:30'))) AS earliest_date");
        assertThat(MySQLPartitionSqlGenerator.offsetLiteral(ZoneOffset.UTC)).isEqualTo("+00:00");
    }
}
