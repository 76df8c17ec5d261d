package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.model.RebalanceBucket;
import com.tradeguard.backend.repository.RebalanceBucketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Fails rebalance buckets whose owner died mid-run, releasing their consistency
 * token so the hour can be retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RebalanceBucketSweeper {

    static final String STALE_REASON = "stale rebalance lock cleanup";

    private final RebalanceBucketRepository bucketRepository;
    private final AllocatorProperties properties;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${allocator.sweeper-interval-ms:120000}")
    public void scheduledSweep() {
        scheduledTaskGuard.run("rebalance-bucket-sweeper", this::sweepStaleBuckets);
    }

    @Transactional
    public int sweepStaleBuckets() {
        Instant now = clock.instant();
        List<RebalanceBucket> stale = bucketRepository.findByStatusAndStartedAtBefore(
                RebalanceBucket.Status.IN_PROGRESS, now.minus(properties.getRebalanceLockTimeout()));
        stale.forEach(bucket -> markFailed(bucket, now));
        return stale.size();
    }

    private void markFailed(RebalanceBucket bucket, Instant now) {
        MDC.put("bucket", bucket.getBucket());
        try {
            bucket.setStatus(RebalanceBucket.Status.FAILED);
            bucket.setConsistencyToken(null);
            bucket.setErrorMessage(STALE_REASON);
            bucket.setCompletedAt(now);
            bucketRepository.save(bucket);
            log.warn("Sweeper marked rebalance bucket as FAILED: bucket={}, startedAt={}", bucket.getBucket(),
                    bucket.getStartedAt());
        } finally {
            MDC.remove("bucket");
        }
    }
}
