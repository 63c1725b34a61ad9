package com.telcobright.partman.db.service;

import com.telcobright.partman.MutableClock;
import com.telcobright.partman.core.enums.CleanupAction;
import com.telcobright.partman.core.exception.ConflictException;
import com.telcobright.partman.core.exception.NotFoundException;
import com.telcobright.partman.core.exception.PartitionException;
import com.telcobright.partman.core.partition.PartitionDefinition;
import com.telcobright.partman.core.partition.PartitionNaming;
import com.telcobright.partman.core.sql.mysql.MySQLPartitionSqlGenerator;
import com.telcobright.partman.db.entity.PartitionConfig;
import com.telcobright.partman.db.metadata.ColumnInfo;
import com.telcobright.partman.db.metadata.DateRange;
import com.telcobright.partman.db.metadata.SchemaIntrospector;
import com.telcobright.partman.db.metadata.TableStats;
import com.telcobright.partman.db.model.MigrationAnalysis;
import com.telcobright.partman.db.model.MigrationResult;
import com.telcobright.partman.db.repository.InMemoryPartitionConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("MigrationService Tests")
class MigrationServiceTest {

    private static final LocalDate EARLIEST = LocalDate.of(2024, 1, 15);
    private static final LocalDate LATEST = LocalDate.of(2025, 12, 24);

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private Statement statement;
    @Mock
    private SchemaIntrospector introspector;

    private final List<String> executed = new ArrayList<>();
    private final Map<String, SQLException> failingStatements = new HashMap<>();

    private PartitionNaming naming;
    private PartitionConfigService configService;
    private MigrationService migrationService;

    @BeforeEach
    void setUp() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute(anyString())).thenAnswer(invocation -> {
            String sql = invocation.getArgument(0);
            for (Map.Entry<String, SQLException> failure : failingStatements.entrySet()) {
                if (sql.contains(failure.getKey())) {
                    throw failure.getValue();
                }
            }
            executed.add(sql);
            return false;
        });

        when(introspector.tableExists(anyString())).thenReturn(true);
        when(introspector.tableStats("users")).thenReturn(Optional.of(new TableStats(1_000_000, 64 << 20, 16 << 20)));
        when(introspector.columnInfo("users", "updatedDate"))
            .thenReturn(Optional.of(new ColumnInfo("updatedDate", "datetime", "datetime", false, null)));
        when(introspector.columnInfo("users", MigrationService.PARTITION_COLUMN)).thenReturn(Optional.empty());
        when(introspector.dateRange("users", "updatedDate", null)).thenReturn(new DateRange(EARLIEST, LATEST, 1_000_000, 710));
        when(introspector.isPartitioned("users")).thenReturn(false);
        when(introspector.primaryKeyColumns("users")).thenReturn(List.of("id"));

        naming = PartitionNaming.ofOffsetMillis(28_800_000L);
        configService = new PartitionConfigService(new InMemoryPartitionConfigRepository(), introspector);
        migrationService = new MigrationService(dataSource, introspector, new MySQLPartitionSqlGenerator(), naming,
            configService, "updatedDate", LocalTime.of(2, 0), MutableClock.at("2025-06-15T02:00:00Z"));
    }

    @Test
    @DisplayName("Should plan one partition per day, the pre-created days and p_future")
    void testPartitionPlanForUsers() {
        List<PartitionDefinition> plan = MigrationService.buildPartitionPlan(EARLIEST, LATEST, 7, naming);

        assertThat(plan).hasSize(718);
        assertThat(plan.get(0).getName()).isEqualTo("p_20240115");
        assertThat(plan.get(0).getLessThan()).isEqualTo(String.valueOf(naming.boundaryValue(EARLIEST)));
        assertThat(plan.get(716).getName()).isEqualTo("p_20251231");
        assertThat(plan.get(717).getName()).isEqualTo(PartitionNaming.FUTURE_PARTITION);
        assertThat(plan.get(717).isMaxValue()).isTrue();
    }

    @Test
    @DisplayName("Should reject a plan whose latest date precedes the earliest")
    void testInvertedRange() {
        assertThatThrownBy(() -> MigrationService.buildPartitionPlan(LATEST, EARLIEST, 7, naming))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should analyze the source column, row count and span")
    void testAnalyze() throws Exception {
        MigrationAnalysis analysis = migrationService.analyzeTableForMigration("users");

        assertThat(analysis.isPartitioned()).isFalse();
        assertThat(analysis.getActualRows()).isEqualTo(1_000_000);
        assertThat(analysis.getDateRange().getEarliest()).isEqualTo(EARLIEST);
        assertThat(analysis.getEstimatedMigrationTime()).isEqualTo("2 minutes");
        assertThat(analysis.getSourceColumn().getDataType()).isEqualTo("datetime");
    }

    @Test
    @DisplayName("Should report a missing source column")
    void testAnalyzeMissingColumn() throws Exception {
        when(introspector.columnInfo("users", "updatedDate")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> migrationService.analyzeTableForMigration("users"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("updatedDate");
    }

    @Test
    @DisplayName("Should run the migration steps in order and register a configuration")
    void testMigrateUsers() throws Exception {
        // When
        MigrationResult result = migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP);

        // Then
        assertThat(result.getPartitionsCreated()).isEqualTo(718);
        assertThat(result.getStartDate()).isEqualTo(EARLIEST);
        assertThat(result.getEndDate()).isEqualTo(LATEST);
        assertThat(result.getConfig().getId()).isNotNull();
        assertThat(result.getConfig().getScheduledTime()).isEqualTo(LocalTime.of(2, 0));

        assertThat(executed).hasSize(6);
        assertThat(executed.get(0)).startsWith("ALTER TABLE `users` ADD COLUMN `partition_date` DATE NULL");
        assertThat(executed.get(1)).isEqualTo("UPDATE `users` SET `partition_date` = DATE(`updatedDate`)");
        assertThat(executed.get(2)).isEqualTo("ALTER TABLE `users` MODIFY COLUMN `partition_date` DATE NOT NULL");
        assertThat(executed.get(3)).isEqualTo("ALTER TABLE `users` ADD INDEX `idx_partition_date` (`partition_date`)");
        assertThat(executed.get(4))
            .isEqualTo("ALTER TABLE `users` DROP PRIMARY KEY, ADD PRIMARY KEY (`id`, `partition_date`)");
        assertThat(executed.get(5))
            .startsWith("ALTER TABLE `users`\nPARTITION BY RANGE (TO_DAYS(`partition_date`))")
            .contains("PARTITION `p_20240115` VALUES LESS THAN (" + naming.boundaryValue(EARLIEST) + ")")
            .endsWith("PARTITION `p_future` VALUES LESS THAN MAXVALUE\n)");
    }

    @Test
    @DisplayName("Should partition an empty table from today")
    void testMigrateEmptyTable() throws Exception {
        when(introspector.dateRange("users", "updatedDate", null)).thenReturn(new DateRange(null, null, 0, 0));

        MigrationResult result = migrationService.migrateTableToPartitions("users", 30, 3, CleanupAction.DROP);

        assertThat(result.getStartDate()).isEqualTo(LocalDate.of(2025, 6, 15));
        assertThat(result.getEndDate()).isEqualTo(LocalDate.of(2025, 6, 15));
        assertThat(result.getPartitionsCreated()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should refuse to migrate a table that is already partitioned")
    void testAlreadyPartitioned() throws Exception {
        when(introspector.isPartitioned("users")).thenReturn(true);

        assertThatThrownBy(() -> migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP))
            .isInstanceOf(ConflictException.class);
        assertThat(executed).isEmpty();
    }

    @Test
    @DisplayName("Should carry on when the partition index already exists")
    void testExistingIndexIgnored() throws Exception {
        failingStatements.put("ADD INDEX", new SQLException("Duplicate key name 'idx_partition_date'", "42000", 1061));

        MigrationResult result = migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP);

        assertThat(result.getPartitionsCreated()).isEqualTo(718);
        assertThat(executed).hasSize(5);
    }

    @Test
    @DisplayName("Should skip column preparation and primary key changes already applied")
    void testRerunAfterPartialMigration() throws Exception {
        when(introspector.columnInfo("users", MigrationService.PARTITION_COLUMN))
            .thenReturn(Optional.of(new ColumnInfo("partition_date", "date", "date", false, null)));
        when(introspector.primaryKeyColumns("users")).thenReturn(List.of("id", "partition_date"));

        migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP);

        assertThat(executed).hasSize(2);
        assertThat(executed.get(0)).contains("ADD INDEX");
        assertThat(executed.get(1)).contains("PARTITION BY RANGE");
    }

    @Test
    @DisplayName("Should back-fill again when an earlier run stopped before the column became NOT NULL")
    void testRerunAfterFailedBackfill() throws Exception {
        // Given the first run fails while populating the new column
        failingStatements.put("UPDATE `users`", new SQLException("Lock wait timeout exceeded", "HY000", 1205));
        assertThatThrownBy(() -> migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP))
            .isInstanceOf(PartitionException.class);
        assertThat(executed).hasSize(1);

        // When the column is there but still nullable and the run is repeated
        failingStatements.clear();
        executed.clear();
        when(introspector.columnInfo("users", MigrationService.PARTITION_COLUMN))
            .thenReturn(Optional.of(new ColumnInfo("partition_date", "date", "date", true, null)));
        migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP);

        // Then
        assertThat(executed).hasSize(5);
        assertThat(executed.get(0)).isEqualTo("UPDATE `users` SET `partition_date` = DATE(`updatedDate`)");
        assertThat(executed.get(1)).isEqualTo("ALTER TABLE `users` MODIFY COLUMN `partition_date` DATE NOT NULL");
        assertThat(executed.get(2)).contains("ADD INDEX");
        assertThat(executed.get(3)).contains("ADD PRIMARY KEY (`id`, `partition_date`)");
        assertThat(executed.get(4)).contains("PARTITION BY RANGE");
    }

    @Test
    @DisplayName("Should take the days of a TIMESTAMP source at the partition offset")
    void testTimestampSourceUsesPartitionOffset() throws Exception {
        when(introspector.columnInfo("users", "updatedDate"))
            .thenReturn(Optional.of(new ColumnInfo("updatedDate", "timestamp", "timestamp", false, null)));
        when(introspector.dateRange("users", "updatedDate", ZoneOffset.ofHours(8)))
            .thenReturn(new DateRange(EARLIEST, LATEST, 1_000_000, 710));

        MigrationResult result = migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP);

        assertThat(result.getStartDate()).isEqualTo(EARLIEST);
        assertThat(executed.get(1))
            .isEqualTo("UPDATE `users` SET `partition_date` = DATE(CONVERT_TZ(`updatedDate`, '+00:00', '+08:00'))");
    }

    @Test
    @DisplayName("Should replace a generated partition column with a regular one")
    void testGeneratedColumnReplaced() throws Exception {
        when(introspector.columnInfo("users", MigrationService.PARTITION_COLUMN))
            .thenReturn(Optional.of(new ColumnInfo("partition_date", "date", "date", false, "cast(`updatedDate` as date)")));

        migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP);

        assertThat(executed.get(0)).isEqualTo("ALTER TABLE `users` DROP COLUMN `partition_date`");
        assertThat(executed.get(1)).contains("ADD COLUMN `partition_date`");
    }

    @Test
    @DisplayName("Should leave the primary key alone on tables without one")
    void testNoPrimaryKey() throws Exception {
        when(introspector.primaryKeyColumns("users")).thenReturn(List.of());

        migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP);

        assertThat(executed).noneMatch(sql -> sql.contains("PRIMARY KEY"));
    }

    @Test
    @DisplayName("Should name the failed step and keep the engine error code")
    void testStepFailure() throws Exception {
        failingStatements.put("UPDATE `users`", new SQLException("Lock wait timeout exceeded", "HY000", 1205));

        assertThatThrownBy(() -> migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP))
            .isInstanceOf(PartitionException.class)
            .hasMessageContaining("populate partition column")
            .satisfies(e -> assertThat(((SQLException) e).getErrorCode()).isEqualTo(1205));
        assertThat(configService.findByTableName("users")).isEmpty();
    }

    @Test
    @DisplayName("Should keep an existing configuration for the migrated table")
    void testExistingConfigKept() throws Exception {
        PartitionConfig existing = new PartitionConfig("users", 90, 14, CleanupAction.TRUNCATE);
        configService.createConfig(existing);

        MigrationResult result = migrationService.migrateTableToPartitions("users", 30, 7, CleanupAction.DROP);

        assertThat(result.getConfig().getRetentionDays()).isEqualTo(90);
        assertThat(result.getConfig().getCleanupAction()).isEqualTo(CleanupAction.TRUNCATE);
        assertThat(configService.getAllConfigs()).hasSize(1);
    }
}
