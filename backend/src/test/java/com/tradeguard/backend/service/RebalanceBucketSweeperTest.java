package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.model.AuditAction;
import com.tradeguard.backend.model.RebalanceBucket;
import com.tradeguard.backend.repository.RebalanceBucketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RebalanceBucketSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:30:00Z");

    @Mock
    private RebalanceBucketRepository bucketRepository;

    @Mock
    private AuditEventService auditEventService;

    private RebalanceBucketSweeper sweeper;

    @BeforeEach
    void setUp() {
        sweeper = new RebalanceBucketSweeper(bucketRepository, new AllocatorProperties(),
                new ScheduledTaskGuard(auditEventService, Clock.fixed(NOW, ZoneOffset.UTC)), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void marksStaleBucketsFailedAndReleasesToken() {
        RebalanceBucket stale = RebalanceBucket.builder()
                .bucket("2026-03-02_10")
                .status(RebalanceBucket.Status.IN_PROGRESS)
                .consistencyToken("rebalance-1")
                .startedAt(NOW.minus(Duration.ofMinutes(20)))
                .build();
        when(bucketRepository.findByStatusAndStartedAtBefore(RebalanceBucket.Status.IN_PROGRESS,
                NOW.minus(Duration.ofMinutes(10)))).thenReturn(List.of(stale));

        int swept = sweeper.sweepStaleBuckets();

        assertThat(swept).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(RebalanceBucket.Status.FAILED);
        assertThat(stale.getConsistencyToken()).isNull();
        assertThat(stale.getErrorMessage()).isEqualTo(RebalanceBucketSweeper.STALE_REASON);
        assertThat(stale.getCompletedAt()).isEqualTo(NOW);
        verify(bucketRepository).save(stale);
    }

    @Test
    void nothingStaleMeansNothingSaved() {
        when(bucketRepository.findByStatusAndStartedAtBefore(any(), any())).thenReturn(List.of());

        assertThat(sweeper.sweepStaleBuckets()).isZero();
        verify(bucketRepository, never()).save(any());
    }

    @Test
    void scheduledSweepSurvivesRepositoryFailure() {
        when(bucketRepository.findByStatusAndStartedAtBefore(any(), any()))
                .thenThrow(new IllegalStateException("database down"));

        sweeper.scheduledSweep();

        verify(bucketRepository, never()).save(any());
        verify(auditEventService).record(eq(AuditAction.TASK_FAILED), eq("rebalance-bucket-sweeper"),
                anyString(), argThat(metadata -> String.valueOf(metadata.get("error")).contains("database down")));
    }
}
