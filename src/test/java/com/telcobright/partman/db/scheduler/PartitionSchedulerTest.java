package com.telcobright.partman.db.scheduler;

import com.telcobright.partman.MutableClock;
import com.telcobright.partman.core.enums.CleanupAction;
import com.telcobright.partman.core.exception.NotFoundException;
import com.telcobright.partman.db.entity.PartitionConfig;
import com.telcobright.partman.db.metadata.SchemaIntrospector;
import com.telcobright.partman.db.model.MaintenanceRunReport;
import com.telcobright.partman.db.model.MaintenanceSummary;
import com.telcobright.partman.db.repository.InMemoryPartitionConfigRepository;
import com.telcobright.partman.db.service.PartitionConfigService;
import com.telcobright.partman.db.service.PartitionLock;
import com.telcobright.partman.db.service.PartitionManagementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("PartitionScheduler Tests")
class PartitionSchedulerTest {

    private static final ZoneOffset OFFSET = ZoneOffset.ofHours(8);
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private static PartitionConfig config(String table, LocalTime scheduledTime) {
        PartitionConfig config = new PartitionConfig(table, 30, 7, CleanupAction.DROP);
        config.setId((long) table.hashCode());
        config.setScheduledTime(scheduledTime);
        return config;
    }

    @Nested
    @DisplayName("Due calculation")
    class DueCalculation {

        @Test
        @DisplayName("Should select a configuration whose time fell within the last tick")
        void testDueWithinWindow() {
            // 02:00:30 at +08:00
            Instant now = Instant.parse("2025-06-15T18:00:30Z");
            PartitionConfig config = config("event_logs", LocalTime.of(2, 0));

            assertThat(PartitionScheduler.dueConfigs(now, OFFSET, WINDOW, List.of(config))).containsExactly(config);
        }

        @Test
        @DisplayName("Should not select a never-run configuration whose time passed before the window")
        void testNeverRunNotDueOutsideWindow() {
            Instant now = Instant.parse("2025-06-15T18:02:00Z");
            PartitionConfig config = config("event_logs", LocalTime.of(2, 0));

            assertThat(PartitionScheduler.dueConfigs(now, OFFSET, WINDOW, List.of(config))).isEmpty();
        }

        @Test
        @DisplayName("Should select a configuration whose occurrence passed during a delayed tick")
        void testDueAfterDelayedTick() {
            // 02:05 local, scheduled 02:01, last ran yesterday
            Instant now = Instant.parse("2025-06-15T18:05:00Z");
            PartitionConfig config = config("metrics", LocalTime.of(2, 1));
            config.setLastRunAt(Instant.parse("2025-06-14T18:01:10Z"));

            assertThat(PartitionScheduler.dueConfigs(now, OFFSET, WINDOW, List.of(config))).containsExactly(config);
        }

        @Test
        @DisplayName("Should widen the tick window back to the previous tick")
        void testTickWindow() {
            Instant now = Instant.parse("2025-06-15T18:05:00Z");

            assertThat(PartitionScheduler.tickWindow(null, now, WINDOW)).isEqualTo(WINDOW);
            assertThat(PartitionScheduler.tickWindow(now.minusSeconds(30), now, WINDOW)).isEqualTo(WINDOW);
            assertThat(PartitionScheduler.tickWindow(now.minus(Duration.ofMinutes(5)), now, WINDOW))
                .isEqualTo(Duration.ofMinutes(5));
        }

        @Test
        @DisplayName("Should not select a configuration that already ran for this occurrence")
        void testNotDueAfterRun() {
            Instant now = Instant.parse("2025-06-15T18:00:30Z");
            PartitionConfig config = config("event_logs", LocalTime.of(2, 0));
            config.setLastRunAt(Instant.parse("2025-06-15T18:00:05Z"));

            assertThat(PartitionScheduler.dueConfigs(now, OFFSET, WINDOW, List.of(config))).isEmpty();

            config.setLastRunAt(Instant.parse("2025-06-14T18:00:05Z"));
            assertThat(PartitionScheduler.dueConfigs(now, OFFSET, WINDOW, List.of(config))).containsExactly(config);
        }

        @Test
        @DisplayName("Should skip disabled configurations")
        void testDisabledNotDue() {
            Instant now = Instant.parse("2025-06-15T18:00:30Z");
            PartitionConfig config = config("event_logs", LocalTime.of(2, 0));
            config.setEnabled(false);

            assertThat(PartitionScheduler.dueConfigs(now, OFFSET, WINDOW, List.of(config))).isEmpty();
        }

        @Test
        @DisplayName("Should catch yesterday's occurrence just after local midnight")
        void testDueAcrossMidnight() {
            // 00:00:30 local on the 16th, scheduled 23:59 on the 15th
            Instant now = Instant.parse("2025-06-15T16:00:30Z");
            PartitionConfig config = config("event_logs", LocalTime.of(23, 59));

            assertThat(PartitionScheduler.dueConfigs(now, OFFSET, Duration.ofMinutes(2), List.of(config)))
                .containsExactly(config);
        }

        @Test
        @DisplayName("Should compute the next run strictly after the given instant")
        void testNextRunAt() {
            PartitionConfig config = config("event_logs", LocalTime.of(2, 0));

            assertThat(PartitionScheduler.nextRunAt(config, Instant.parse("2025-06-15T18:00:00Z"), OFFSET))
                .isEqualTo(Instant.parse("2025-06-16T18:00:00Z"));
            assertThat(PartitionScheduler.nextRunAt(config, Instant.parse("2025-06-15T17:00:00Z"), OFFSET))
                .isEqualTo(Instant.parse("2025-06-15T18:00:00Z"));
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @MockitoSettings(strictness = Strictness.LENIENT)
    @DisplayName("Maintenance runs")
    class MaintenanceRuns {

        @Mock
        private PartitionManagementService managementService;
        @Mock
        private SchemaIntrospector introspector;

        private MutableClock clock;
        private InMemoryPartitionConfigRepository repository;
        private PartitionConfigService configService;
        private PartitionScheduler scheduler;
        private PartitionConfig eventLogs;

        @BeforeEach
        void setUp() throws Exception {
            clock = MutableClock.at("2025-06-15T18:00:10Z");
            repository = new InMemoryPartitionConfigRepository();
            when(introspector.tableExists(anyString())).thenReturn(true);
            configService = new PartitionConfigService(repository, introspector);
            scheduler = new PartitionScheduler(configService, managementService, new PartitionLock(repository),
                Runnable::run, OFFSET, WINDOW, true, clock);

            PartitionConfig config = new PartitionConfig("event_logs", 30, 7, CleanupAction.DROP);
            config.setScheduledTime(LocalTime.of(2, 0));
            eventLogs = configService.createConfig(config);

            when(managementService.ensureFuturePartitions(any(PartitionConfig.class))).thenAnswer(invocation -> {
                MaintenanceSummary summary = MaintenanceSummary.empty();
                summary.recordSuccess();
                return summary;
            });
            when(managementService.cleanupOldPartitions(any(PartitionConfig.class))).thenReturn(MaintenanceSummary.empty());
            when(managementService.ensureFuturePartitions(anyList())).thenReturn(MaintenanceSummary.empty());
        }

        @Test
        @DisplayName("Should ensure then clean up under the lock and record run times")
        void testRunMaintenance() throws Exception {
            // When
            MaintenanceRunReport report = scheduler.runMaintenance(eventLogs);

            // Then
            assertThat(report.getOutcome()).isEqualTo(MaintenanceRunReport.Outcome.COMPLETED);
            assertThat(report.getCreation().getSucceeded()).isEqualTo(1);

            PartitionConfig stored = configService.getConfig(eventLogs.getId());
            assertThat(stored.isRunning()).isFalse();
            assertThat(stored.getLastRunAt()).isEqualTo(clock.instant());
            assertThat(stored.getNextRunAt()).isEqualTo(Instant.parse("2025-06-16T18:00:00Z"));

            var order = inOrder(managementService);
            order.verify(managementService).ensureFuturePartitions(any(PartitionConfig.class));
            order.verify(managementService).cleanupOldPartitions(any(PartitionConfig.class));
        }

        @Test
        @DisplayName("Should skip a table whose lock is held")
        void testSkipWhenLocked() throws Exception {
            repository.tryAcquireLock(eventLogs.getId());

            MaintenanceRunReport report = scheduler.runMaintenance(eventLogs);

            assertThat(report.getOutcome()).isEqualTo(MaintenanceRunReport.Outcome.SKIPPED_LOCKED);
            verify(managementService, never()).ensureFuturePartitions(any(PartitionConfig.class));
            assertThat(configService.getConfig(eventLogs.getId()).isRunning()).isTrue();
        }

        @Test
        @DisplayName("Should release the lock when maintenance throws")
        void testReleaseOnFailure() throws Exception {
            when(managementService.ensureFuturePartitions(any(PartitionConfig.class)))
                .thenThrow(new IllegalStateException("connection reset"));

            MaintenanceRunReport report = scheduler.runMaintenance(eventLogs);

            assertThat(report.getOutcome()).isEqualTo(MaintenanceRunReport.Outcome.FAILED);
            assertThat(report.getError()).isEqualTo("connection reset");
            assertThat(configService.getConfig(eventLogs.getId()).isRunning()).isFalse();
            assertThat(configService.getConfig(eventLogs.getId()).getLastRunAt()).isNull();
        }

        @Test
        @DisplayName("Should run a due table once per occurrence")
        void testTickRunsOncePerOccurrence() throws Exception {
            scheduler.tick();
            clock.advance(Duration.ofSeconds(30));
            scheduler.tick();

            verify(managementService, times(1)).ensureFuturePartitions(any(PartitionConfig.class));
        }

        @Test
        @DisplayName("Should run a never-run table whose time passed while the previous tick was busy")
        void testTickAfterLongRun() throws Exception {
            PartitionConfig metrics = new PartitionConfig("metrics", 30, 7, CleanupAction.TRUNCATE);
            metrics.setScheduledTime(LocalTime.of(2, 1));
            configService.createConfig(metrics);

            // Given event_logs runs at 02:00:10 and the next tick only fires at 02:05
            scheduler.tick();
            clock.set(Instant.parse("2025-06-15T18:05:00Z"));

            // When
            scheduler.tick();

            // Then
            assertThat(configService.findByTableName("metrics").orElseThrow().getLastRunAt())
                .isEqualTo(Instant.parse("2025-06-15T18:05:00Z"));
            verify(managementService, times(2)).ensureFuturePartitions(any(PartitionConfig.class));
        }

        @Test
        @DisplayName("Should not run anything on a tick outside the scheduled time")
        void testTickNothingDue() throws Exception {
            clock.set(Instant.parse("2025-06-15T20:00:10Z"));

            scheduler.tick();

            verify(managementService, never()).ensureFuturePartitions(any(PartitionConfig.class));
        }

        @Test
        @DisplayName("Should run every active table on manual trigger")
        void testManualTriggerAll() throws Exception {
            PartitionConfig metrics = new PartitionConfig("metrics", 30, 7, CleanupAction.TRUNCATE);
            configService.createConfig(metrics);

            List<MaintenanceRunReport> reports = scheduler.triggerManualMaintenance();

            assertThat(reports).extracting(MaintenanceRunReport::getTableName)
                .containsExactlyInAnyOrder("event_logs", "metrics");
            assertThat(reports).allMatch(r -> r.getOutcome() == MaintenanceRunReport.Outcome.COMPLETED);
        }

        @Test
        @DisplayName("Should reject a manual trigger for a table without configuration")
        void testManualTriggerUnknownTable() {
            assertThatThrownBy(() -> scheduler.triggerManualMaintenance("ghost")).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Should keep going when startup maintenance fails")
        void testStartupMaintenanceFailure() {
            when(managementService.ensureFuturePartitions(anyList())).thenThrow(new IllegalStateException("db down"));

            assertThatCode(() -> scheduler.runStartupMaintenance()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should run startup maintenance on start and stop cleanly")
        void testStartAndStop() {
            scheduler.start();
            scheduler.stop();

            verify(managementService).ensureFuturePartitions(anyList());
        }

        @Test
        @DisplayName("Should not start when disabled")
        void testDisabled() {
            PartitionScheduler disabled = new PartitionScheduler(configService, managementService,
                new PartitionLock(repository), Runnable::run, OFFSET, WINDOW, false, clock);

            disabled.start();
            disabled.stop();

            verifyNoInteractions(managementService);
        }
    }
}
