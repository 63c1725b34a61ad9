package com.telcobright.partman.db.scheduler;

import com.telcobright.partman.core.exception.FailureStoreException;
import com.telcobright.partman.db.model.MaintenanceSummary;
import com.telcobright.partman.db.service.PartitionRetryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FailureRetryScheduler Tests")
class FailureRetrySchedulerTest {

    @Mock
    private PartitionRetryService retryService;

    @Test
    @DisplayName("Should survive a sweep that cannot reach the failure store")
    void testSweepFailureContained() throws Exception {
        when(retryService.retryFailedPartitions()).thenThrow(new FailureStoreException("store down", null));
        FailureRetryScheduler scheduler = new FailureRetryScheduler(retryService, Duration.ofHours(2));

        assertThatCode(scheduler::sweep).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should sweep repeatedly once started")
    void testPeriodicSweep() throws Exception {
        when(retryService.retryFailedPartitions()).thenReturn(MaintenanceSummary.empty());
        FailureRetryScheduler scheduler = new FailureRetryScheduler(retryService, Duration.ofMillis(50));

        scheduler.start();
        try {
            await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> verify(retryService, atLeast(2)).retryFailedPartitions());
        } finally {
            scheduler.stop();
        }
    }
}
