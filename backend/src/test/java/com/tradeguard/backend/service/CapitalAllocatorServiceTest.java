package com.tradeguard.backend.service;

import com.tradeguard.backend.dto.ComplianceSummary;
import com.tradeguard.backend.dto.FreezeResult;
import com.tradeguard.backend.dto.LedgerView;
import com.tradeguard.backend.dto.PoolStatus;
import com.tradeguard.backend.dto.ProductionMetrics;
import com.tradeguard.backend.dto.RebalanceResult;
import com.tradeguard.backend.dto.StageRequest;
import com.tradeguard.backend.dto.StrategyPerformance;
import com.tradeguard.backend.exception.ConflictException;
import com.tradeguard.backend.exception.FailClosedException;
import com.tradeguard.backend.exception.PromotionPrecheckException;
import com.tradeguard.backend.model.Allocation;
import com.tradeguard.backend.model.RebalanceBucket;
import com.tradeguard.backend.repository.AllocationRepository;
import com.tradeguard.backend.repository.RebalanceBucketRepository;
import com.tradeguard.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class CapitalAllocatorServiceTest {

    private static final Instant START = Instant.parse("2026-03-02T10:15:00Z");

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        public MutableClock testClock() {
            return new MutableClock(START);
        }
    }

    @MockBean
    private ProductionPerformanceService performanceService;

    @MockBean
    private MarketRecorderService marketRecorderService;

    @MockBean
    private ComplianceSummaryService complianceSummaryService;

    @Autowired
    private CapitalAllocatorService allocator;

    @Autowired
    private AllocationRepository allocationRepository;

    @Autowired
    private RebalanceBucketRepository bucketRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM allocations");
        jdbcTemplate.update("DELETE FROM rebalance_buckets");
        clock.set(START);
        when(performanceService.currentMetrics()).thenReturn(ProductionMetrics.unavailable(100_000, 3));
        when(performanceService.currentEquity()).thenReturn(100_000.0);
        when(marketRecorderService.latestQuoteReceivedAt()).thenAnswer(invocation -> Optional.of(clock.instant()));
        when(marketRecorderService.latestQuote(any())).thenReturn(Optional.empty());
        when(marketRecorderService.fillsForAllocations(any())).thenReturn(List.of());
        when(complianceSummaryService.summarizeTrailing())
                .thenReturn(ComplianceSummary.builder().passed(true).reasons(List.of()).dataAvailable(true).build());
    }

    @Test
    void activatesWithinCapAndRejectsWhatWouldExceedIt() {
        Allocation existing = seedActive("strat-existing", 0.02, START.minus(Duration.ofDays(1)));

        Allocation staged = allocator.stage(stageRequest("strat-a", 0.03, "tok-a"));
        assertThat(staged.getStatus()).isEqualTo(Allocation.Status.STAGED);

        RebalanceResult first = allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, null);

        assertThat(first.poolCap()).isEqualTo(0.05);
        assertThat(first.beforeTotal()).isEqualTo(0.02);
        assertThat(first.afterTotal()).isEqualTo(0.05);
        assertThat(first.activated()).extracting("id").containsExactly(staged.getId());
        assertThat(first.rejected()).isEmpty();
        assertThat(allocationRepository.findById(staged.getId()).orElseThrow().getStatus())
                .isEqualTo(Allocation.Status.ACTIVE);

        clock.advance(Duration.ofHours(1));
        Allocation late = allocator.stage(stageRequest("strat-b", 0.01, "tok-b"));
        RebalanceResult second = allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, null);

        assertThat(second.activated()).isEmpty();
        assertThat(second.rejected()).extracting("reason").containsExactly(CapitalAllocatorService.WOULD_EXCEED_CAP);
        Allocation rejected = allocationRepository.findById(late.getId()).orElseThrow();
        assertThat(rejected.getStatus()).isEqualTo(Allocation.Status.EXPIRED);
        assertThat(rejected.getStatusReason()).isEqualTo(CapitalAllocatorService.WOULD_EXCEED_CAP);
        assertThat(allocationRepository.findById(existing.getId()).orElseThrow().getStatus())
                .isEqualTo(Allocation.Status.ACTIVE);
    }

    @Test
    void restagingWithSameTokenReturnsExistingAllocation() {
        Allocation first = allocator.stage(stageRequest("strat-a", 0.02, "tok-1"));
        Allocation second = allocator.stage(stageRequest("strat-a", 0.02, "tok-1"));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(allocationRepository.count()).isEqualTo(1);
    }

    @Test
    void stagingFailsClosedWithoutRecentQuotes() {
        when(marketRecorderService.latestQuoteReceivedAt())
                .thenReturn(Optional.of(START.minus(Duration.ofMinutes(30))));

        assertThatThrownBy(() -> allocator.stage(stageRequest("strat-a", 0.02, "tok-1")))
                .isInstanceOf(FailClosedException.class);
        assertThat(allocationRepository.count()).isZero();
    }

    @Test
    void stagingFailsClosedWhenComplianceFails() {
        when(complianceSummaryService.summarizeTrailing()).thenReturn(ComplianceSummary.builder()
                .passed(false)
                .reasons(List.of("NBBO_FRESHNESS_INSUFFICIENT: 90.0% < 95.0%"))
                .dataAvailable(true)
                .build());

        assertThatThrownBy(() -> allocator.stage(stageRequest("strat-a", 0.02, "tok-1")))
                .isInstanceOf(FailClosedException.class);
        assertThat(allocationRepository.count()).isZero();
    }

    @Test
    void stagingRejectsStrategyThatFailsPrecheck() {
        StageRequest request = stageRequest("strat-a", 0.02, "tok-1");
        request.getPerformance().setSharpe(0.4);

        assertThatThrownBy(() -> allocator.stage(request)).isInstanceOf(PromotionPrecheckException.class);
        assertThat(allocationRepository.count()).isZero();
    }

    @Test
    void previewPersistsNothing() {
        Allocation staged = allocator.stage(stageRequest("strat-a", 0.03, "tok-1"));

        RebalanceResult preview = allocator.rebalance(RebalanceResult.RebalanceMode.PREVIEW, null);

        assertThat(preview.mode()).isEqualTo(RebalanceResult.RebalanceMode.PREVIEW);
        assertThat(preview.activated()).extracting("id").containsExactly(staged.getId());
        assertThat(allocationRepository.findById(staged.getId()).orElseThrow().getStatus())
                .isEqualTo(Allocation.Status.STAGED);
        assertThat(bucketRepository.count()).isZero();
    }

    @Test
    void repeatedRebalanceInSameHourReplaysRecordedResult() {
        allocator.stage(stageRequest("strat-a", 0.03, "tok-1"));
        RebalanceResult applied = allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, "rebalance-1");

        allocator.stage(stageRequest("strat-b", 0.01, "tok-2"));
        RebalanceResult byToken = allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, "rebalance-1");
        RebalanceResult byBucket = allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, null);

        assertThat(applied.replayed()).isFalse();
        assertThat(byToken.replayed()).isTrue();
        assertThat(byBucket.replayed()).isTrue();
        assertThat(byToken.activated()).isEqualTo(applied.activated());
        assertThat(byBucket.bucket()).isEqualTo(applied.bucket());
        assertThat(allocationRepository.findByStatusOrderByCreatedAtAsc(Allocation.Status.STAGED)).hasSize(1);
    }

    @Test
    void freshInProgressBucketBlocksSecondRun() {
        bucketRepository.save(bucket(START.minus(Duration.ofMinutes(1))));

        assertThatThrownBy(() -> allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, null))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void staleInProgressBucketIsTakenOver() {
        bucketRepository.save(bucket(START.minus(Duration.ofMinutes(15))));
        Allocation staged = allocator.stage(stageRequest("strat-a", 0.02, "tok-1"));

        RebalanceResult result = allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, null);

        assertThat(result.replayed()).isFalse();
        assertThat(result.activated()).extracting("id").containsExactly(staged.getId());
        assertThat(bucketRepository.findById(CapitalAllocatorService.BUCKET_FORMAT.format(START)).orElseThrow()
                .getStatus()).isEqualTo(RebalanceBucket.Status.COMPLETED);
    }

    @Test
    void expiredActiveAllocationsLeaveThePool() {
        Allocation stale = seedActive("strat-old", 0.02, START.minus(Duration.ofDays(10)));
        Allocation old = allocationRepository.findById(stale.getId()).orElseThrow();
        old.setTtlUntil(START.minus(Duration.ofHours(1)));
        allocationRepository.save(old);

        RebalanceResult result = allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, null);

        assertThat(result.expired()).extracting("reason").containsExactly(CapitalAllocatorService.TTL_EXPIRED);
        assertThat(result.afterTotal()).isZero();
    }

    @Test
    void shrinkingCapRetiresNewestActiveAllocations() {
        Allocation older = seedActive("strat-older", 0.03, START.minus(Duration.ofDays(2)));
        Allocation newer = seedActive("strat-newer", 0.03, START.minus(Duration.ofDays(1)));
        Allocation staged = allocator.stage(stageRequest("strat-staged", 0.01, "tok-1"));
        // 1.2% drawdown costs the full 0.02 penalty: cap 0.05 -> 0.03
        when(performanceService.currentMetrics()).thenReturn(new ProductionMetrics(0.5, 0.012, 20, 100_000, true));

        RebalanceResult result = allocator.rebalance(RebalanceResult.RebalanceMode.EXECUTE, null);

        assertThat(result.poolCap()).isEqualTo(0.03);
        assertThat(result.beforeTotal()).isEqualTo(0.06);
        assertThat(result.afterTotal()).isLessThanOrEqualTo(result.poolCap());
        assertThat(result.expired()).extracting("id").containsExactly(newer.getId());
        assertThat(result.expired()).extracting("reason").containsExactly(CapitalAllocatorService.CAP_REDUCED);
        assertThat(result.rejected()).extracting("id").containsExactly(staged.getId());

        Allocation retired = allocationRepository.findById(newer.getId()).orElseThrow();
        assertThat(retired.getStatus()).isEqualTo(Allocation.Status.EXPIRED);
        assertThat(retired.getStatusReason()).isEqualTo("pool cap reduced");
        assertThat(allocationRepository.findById(older.getId()).orElseThrow().getStatus())
                .isEqualTo(Allocation.Status.ACTIVE);
        assertThat(allocator.poolStatus().activeTotal()).isEqualTo(0.03);
    }

    @Test
    void freezeTouchesOnlyActiveAllocations() {
        Allocation active = seedActive("strat-active", 0.02, START.minus(Duration.ofDays(1)));
        Allocation staged = allocator.stage(stageRequest("strat-staged", 0.01, "tok-1"));

        FreezeResult result = allocator.emergencyFreeze("desk halt");

        assertThat(result.frozenIds()).containsExactly(active.getId());
        assertThat(allocationRepository.findById(active.getId()).orElseThrow().getStatus())
                .isEqualTo(Allocation.Status.FROZEN);
        assertThat(allocationRepository.findById(staged.getId()).orElseThrow().getStatus())
                .isEqualTo(Allocation.Status.STAGED);
    }

    @Test
    void poolStatusAndLedgerReflectActiveAllocations() {
        seedActive("strat-active", 0.02, START.minus(Duration.ofDays(1)));
        allocator.stage(stageRequest("strat-staged", 0.01, "tok-1"));

        PoolStatus status = allocator.poolStatus();
        LedgerView ledger = allocator.ledger();

        assertThat(status.poolCap()).isEqualTo(0.05);
        assertThat(status.activeTotal()).isEqualTo(0.02);
        assertThat(status.stagedTotal()).isEqualTo(0.01);
        assertThat(status.availableCapacity()).isEqualTo(0.03);
        assertThat(ledger.allocations()).hasSize(2);
        assertThat(ledger.totalAllocation()).isEqualTo(0.02);
    }

    private Allocation seedActive(String strategy, double fraction, Instant createdAt) {
        return allocationRepository.saveAndFlush(Allocation.builder()
                .id(UUID.randomUUID().toString())
                .sessionId("seed")
                .strategyRef(strategy)
                .pool("EVO")
                .allocation(fraction)
                .status(Allocation.Status.ACTIVE)
                .statusReason("seeded")
                .ttlUntil(START.plus(Duration.ofDays(7)))
                .consistencyToken("seed-" + strategy)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build());
    }

    private static RebalanceBucket bucket(Instant startedAt) {
        return RebalanceBucket.builder()
                .bucket(CapitalAllocatorService.BUCKET_FORMAT.format(START))
                .status(RebalanceBucket.Status.IN_PROGRESS)
                .startedAt(startedAt)
                .build();
    }

    private static StageRequest stageRequest(String strategy, double fraction, String token) {
        return StageRequest.builder()
                .sessionId("session-1")
                .strategyRef(strategy)
                .allocation(fraction)
                .consistencyToken(token)
                .performance(StrategyPerformance.builder()
                        .sharpe(1.5)
                        .maxDrawdown(0.08)
                        .winRate(0.55)
                        .trades(40)
                        .avgSlippageBps(5.0)
                        .traceCompleteness(0.99)
                        .build())
                .build();
    }
}
