package com.tradeguard.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.dto.AllocationChange;
import com.tradeguard.backend.dto.ComplianceSummary;
import com.tradeguard.backend.dto.FreezeResult;
import com.tradeguard.backend.dto.LedgerView;
import com.tradeguard.backend.dto.PoolStatus;
import com.tradeguard.backend.dto.PrecheckResult;
import com.tradeguard.backend.dto.ProductionMetrics;
import com.tradeguard.backend.dto.RebalanceResult;
import com.tradeguard.backend.dto.StageRequest;
import com.tradeguard.backend.dto.StrategyPerformance;
import com.tradeguard.backend.exception.BadRequestException;
import com.tradeguard.backend.exception.ConflictException;
import com.tradeguard.backend.exception.FailClosedException;
import com.tradeguard.backend.exception.PromotionPrecheckException;
import com.tradeguard.backend.model.Allocation;
import com.tradeguard.backend.model.AuditAction;
import com.tradeguard.backend.model.FillSnapshot;
import com.tradeguard.backend.model.QuoteSnapshot;
import com.tradeguard.backend.model.RebalanceBucket;
import com.tradeguard.backend.repository.AllocationRepository;
import com.tradeguard.backend.repository.RebalanceBucketRepository;
import com.tradeguard.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sole writer of allocation state.
 * <p>
 * Staging is idempotent on (session, strategy, token). Rebalancing claims the
 * current UTC hour bucket before touching any allocation, so each bucket is
 * applied at most once; a repeated call or a reused token returns the recorded
 * result. A bucket left {@code IN_PROGRESS} longer than the lock timeout may be
 * taken over by a later run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CapitalAllocatorService {

    public static final String WOULD_EXCEED_CAP = "would exceed pool cap";
    static final String TTL_EXPIRED = "ttl expired";
    static final String CAP_REDUCED = "pool cap reduced";
    static final DateTimeFormatter BUCKET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH").withZone(ZoneOffset.UTC);
    private static final double EPSILON = 1e-9;

    private final AllocationRepository allocationRepository;
    private final RebalanceBucketRepository bucketRepository;
    private final MarketRecorderService marketRecorderService;
    private final ComplianceSummaryService complianceSummaryService;
    private final ProductionPerformanceService performanceService;
    private final PoolCapCalculator poolCapCalculator;
    private final PromotionPrecheck promotionPrecheck;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final AllocatorProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Allocation stage(StageRequest request) {
        validate(request);
        Optional<Allocation> existing = allocationRepository.findBySessionIdAndStrategyRefAndConsistencyToken(
                request.getSessionId(), request.getStrategyRef(), request.getConsistencyToken());
        if (existing.isPresent()) {
            return replayStage(existing.get());
        }

        PrecheckResult precheck = promotionPrecheck.evaluate(request.getPerformance());
        if (!precheck.passed()) {
            log.info("Promotion precheck failed strategy={} failures={}", request.getStrategyRef(), precheck.failures());
            throw new PromotionPrecheckException(precheck.failures());
        }
        requireFreshMarketData();
        if (properties.isRequireCompliancePass()) {
            ComplianceSummary compliance = complianceSummaryService.summarizeTrailing();
            if (!compliance.passed()) {
                throw new FailClosedException("COMPLIANCE_FAILED", String.join("; ", compliance.reasons()),
                        "Trailing compliance summary did not pass");
            }
        }

        Instant now = clock.instant();
        int ttlDays = request.getTtlDays() != null ? request.getTtlDays() : properties.getDefaultTtlDays();
        Allocation allocation = Allocation.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(request.getSessionId())
                .strategyRef(request.getStrategyRef())
                .pool(request.getPool() == null || request.getPool().isBlank() ? properties.getDefaultPool()
                        : request.getPool())
                .allocation(request.getAllocation())
                .status(Allocation.Status.STAGED)
                .statusReason("staged")
                .ttlUntil(now.plus(Duration.ofDays(ttlDays)))
                .consistencyToken(request.getConsistencyToken())
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            Allocation saved = allocationRepository.saveAndFlush(allocation);
            log.info("Staged allocation id={} strategy={} allocation={}", saved.getId(), saved.getStrategyRef(),
                    saved.getAllocation());
            auditEventService.record(AuditAction.ALLOCATION_STAGED, saved.getId(), "Allocation staged",
                    Map.of("strategyRef", saved.getStrategyRef(), "allocation", saved.getAllocation()));
            return saved;
        } catch (DataIntegrityViolationException e) {
            return allocationRepository.findBySessionIdAndStrategyRefAndConsistencyToken(
                            request.getSessionId(), request.getStrategyRef(), request.getConsistencyToken())
                    .map(this::replayStage)
                    .orElseThrow(() -> new ConflictException("Allocation token collision"));
        }
    }

    public PrecheckResult precheck(StrategyPerformance performance) {
        return promotionPrecheck.evaluate(performance);
    }

    public RebalanceResult rebalance(RebalanceResult.RebalanceMode mode, String consistencyToken) {
        RebalanceResult.RebalanceMode effective = mode == null ? RebalanceResult.RebalanceMode.PREVIEW : mode;
        Instant now = clock.instant();
        String bucket = BUCKET_FORMAT.format(now);
        if (effective == RebalanceResult.RebalanceMode.PREVIEW) {
            return transactionTemplate.execute(status -> {
                RebalanceResult preview = plan(bucket, effective, now, false);
                status.setRollbackOnly();
                return preview;
            });
        }

        String token = consistencyToken == null || consistencyToken.isBlank() ? null : consistencyToken;
        if (token != null) {
            Optional<RebalanceResult> byToken = bucketRepository.findByConsistencyToken(token)
                    .filter(recorded -> recorded.getStatus() == RebalanceBucket.Status.COMPLETED)
                    .map(this::replay);
            if (byToken.isPresent()) {
                return byToken.get();
            }
        }

        Optional<RebalanceResult> recorded = claim(bucket, token, now);
        if (recorded.isPresent()) {
            return recorded.get();
        }

        try {
            RebalanceResult result = transactionTemplate.execute(status -> {
                RebalanceResult applied = plan(bucket, effective, now, true);
                RebalanceBucket marker = bucketRepository.findById(bucket)
                        .orElseThrow(() -> new IllegalStateException("Rebalance bucket vanished: " + bucket));
                marker.setStatus(RebalanceBucket.Status.COMPLETED);
                marker.setPoolCap(applied.poolCap());
                marker.setResultJson(toJson(applied));
                marker.setCompletedAt(clock.instant());
                bucketRepository.save(marker);
                return applied;
            });
            metricsService.updatePool(result.poolCap(), result.poolCap() > 0 ? result.afterTotal() / result.poolCap() : 0.0);
            auditEventService.record(AuditAction.REBALANCE_APPLIED, bucket, "Rebalance applied", Map.of(
                    "poolCap", result.poolCap(),
                    "activated", result.activated().size(),
                    "rejected", result.rejected().size(),
                    "expired", result.expired().size()));
            log.info("Rebalance bucket={} cap={} before={} after={} activated={} rejected={} expired={}", bucket,
                    result.poolCap(), result.beforeTotal(), result.afterTotal(), result.activated().size(),
                    result.rejected().size(), result.expired().size());
            return result;
        } catch (RuntimeException e) {
            markFailed(bucket, e);
            throw e;
        }
    }

    @Scheduled(cron = "${allocator.rebalance-cron:0 5 * * * *}", zone = "UTC")
    public void scheduledRebalance() {
        if (!properties.isRebalanceScheduleEnabled()) {
            return;
        }
        scheduledTaskGuard.run("allocator-rebalance",
                () -> rebalance(RebalanceResult.RebalanceMode.EXECUTE, null));
    }

    public LedgerView ledger() {
        Instant now = clock.instant();
        BigDecimal equity = MoneyUtils.bd(performanceService.currentEquity());
        List<Allocation> allocations;
        try {
            allocations = allocationRepository.findByStatusInOrderByCreatedAtAsc(
                    EnumSet.of(Allocation.Status.STAGED, Allocation.Status.ACTIVE, Allocation.Status.FROZEN));
        } catch (RuntimeException e) {
            log.warn("Ledger allocations unavailable: {}", e.getMessage());
            return new LedgerView(List.of(), 0.0, equity, MoneyUtils.ZERO, MoneyUtils.ZERO, false, now);
        }

        Map<String, Position> positions;
        boolean pnlAvailable = true;
        try {
            positions = positions(allocations);
        } catch (RuntimeException e) {
            log.warn("Ledger PnL unavailable: {}", e.getMessage());
            positions = Map.of();
            pnlAvailable = false;
        }

        List<LedgerView.Entry> entries = new ArrayList<>();
        BigDecimal realized = MoneyUtils.ZERO;
        BigDecimal unrealized = MoneyUtils.ZERO;
        double total = 0.0;
        for (Allocation allocation : allocations) {
            Position position = positions.getOrDefault(allocation.getId(), Position.EMPTY);
            realized = MoneyUtils.add(realized, position.realized());
            unrealized = MoneyUtils.add(unrealized, position.unrealized());
            if (allocation.getStatus() == Allocation.Status.ACTIVE) {
                total += allocation.getAllocation();
            }
            entries.add(new LedgerView.Entry(
                    allocation.getId(),
                    allocation.getSessionId(),
                    allocation.getStrategyRef(),
                    allocation.getPool(),
                    allocation.getAllocation(),
                    allocation.getStatus().name(),
                    allocation.getTtlUntil(),
                    MoneyUtils.scale(equity.multiply(BigDecimal.valueOf(allocation.getAllocation()))),
                    position.openQuantity(),
                    position.realized(),
                    position.unrealized()));
        }
        return new LedgerView(List.copyOf(entries), MoneyUtils.round(total, 6), equity, realized, unrealized,
                pnlAvailable, now);
    }

    public PoolStatus poolStatus() {
        ProductionMetrics metrics = performanceService.currentMetrics();
        double cap = poolCapCalculator.compute(metrics);
        try {
            List<Allocation> active = allocationRepository.findByStatusOrderByCreatedAtAsc(Allocation.Status.ACTIVE);
            List<Allocation> staged = allocationRepository.findByStatusOrderByCreatedAtAsc(Allocation.Status.STAGED);
            double activeTotal = sum(active);
            double utilization = cap > 0 ? activeTotal / cap : 1.0;
            return new PoolStatus(cap, MoneyUtils.round(activeTotal, 6), MoneyUtils.round(sum(staged), 6),
                    MoneyUtils.round(Math.max(0.0, cap - activeTotal), 6), MoneyUtils.round(utilization, 4),
                    active.size(), staged.size(), riskLevel(utilization), metrics, true);
        } catch (RuntimeException e) {
            log.warn("Pool status degraded: {}", e.getMessage());
            return new PoolStatus(cap, 0.0, 0.0, 0.0, 0.0, 0, 0, "UNKNOWN", metrics, false);
        }
    }

    public FreezeResult emergencyFreeze(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new BadRequestException("Freeze reason is required");
        }
        Instant now = clock.instant();
        List<String> frozen = transactionTemplate.execute(status -> {
            List<Allocation> active = allocationRepository.findByStatusOrderByCreatedAtAsc(Allocation.Status.ACTIVE);
            active.forEach(allocation -> allocation.transitionTo(Allocation.Status.FROZEN, reason, now));
            allocationRepository.saveAll(active);
            return active.stream().map(Allocation::getId).toList();
        });
        log.warn("EMERGENCY FREEZE: {} allocations frozen, reason={}", frozen.size(), reason);
        auditEventService.record(AuditAction.EMERGENCY_FREEZE, "pool", reason,
                Map.of("frozen", frozen, "reason", reason));
        metricsService.updatePool(poolCapCalculator.compute(performanceService.currentMetrics()), 0.0);
        return new FreezeResult(frozen, reason, now);
    }

    /**
     * Computes the rebalance against current state; applies it only when {@code persist}.
     */
    private RebalanceResult plan(String bucket, RebalanceResult.RebalanceMode mode, Instant now, boolean persist) {
        ProductionMetrics metrics = performanceService.currentMetrics();
        double cap = poolCapCalculator.compute(metrics);
        List<Allocation> active = new ArrayList<>(
                allocationRepository.findByStatusOrderByCreatedAtAsc(Allocation.Status.ACTIVE));
        List<Allocation> staged = allocationRepository.findByStatusOrderByCreatedAtAsc(Allocation.Status.STAGED);

        double beforeTotal = sum(active);
        double running = beforeTotal;
        List<AllocationChange> activated = new ArrayList<>();
        List<AllocationChange> rejected = new ArrayList<>();
        List<AllocationChange> expired = new ArrayList<>();
        List<Allocation> touched = new ArrayList<>();

        for (Allocation allocation : List.copyOf(active)) {
            if (!allocation.getTtlUntil().isAfter(now)) {
                running -= allocation.getAllocation();
                active.remove(allocation);
                change(allocation, Allocation.Status.EXPIRED, TTL_EXPIRED, now, expired, touched);
            }
        }
        // Shrinking cap: retire the newest active allocations until the pool fits again.
        active.sort(Comparator.comparing(Allocation::getCreatedAt).reversed());
        for (Allocation allocation : active) {
            if (running <= cap + EPSILON) {
                break;
            }
            running -= allocation.getAllocation();
            change(allocation, Allocation.Status.EXPIRED, CAP_REDUCED, now, expired, touched);
        }
        for (Allocation allocation : staged) {
            if (!allocation.getTtlUntil().isAfter(now)) {
                change(allocation, Allocation.Status.EXPIRED, TTL_EXPIRED, now, expired, touched);
            } else if (running + allocation.getAllocation() <= cap + EPSILON) {
                running += allocation.getAllocation();
                change(allocation, Allocation.Status.ACTIVE, "activated within pool cap", now, activated, touched);
            } else {
                change(allocation, Allocation.Status.EXPIRED, WOULD_EXCEED_CAP, now, rejected, touched);
            }
        }

        if (persist && !touched.isEmpty()) {
            allocationRepository.saveAll(touched);
        }
        return RebalanceResult.builder()
                .bucket(bucket)
                .mode(mode)
                .poolCap(cap)
                .beforeTotal(MoneyUtils.round(beforeTotal, 6))
                .afterTotal(MoneyUtils.round(Math.max(0.0, running), 6))
                .activated(List.copyOf(activated))
                .rejected(List.copyOf(rejected))
                .expired(List.copyOf(expired))
                .metrics(metrics)
                .computedAt(now)
                .replayed(false)
                .build();
    }

    private static void change(Allocation allocation, Allocation.Status next, String reason, Instant now,
                               List<AllocationChange> into, List<Allocation> touched) {
        allocation.transitionTo(next, reason, now);
        into.add(new AllocationChange(allocation.getId(), allocation.getStrategyRef(), allocation.getAllocation(),
                reason));
        touched.add(allocation);
    }

    /**
     * Takes the bucket marker. Returns the recorded result when the bucket is already
     * complete; throws when another run holds a fresh lock.
     */
    private Optional<RebalanceResult> claim(String bucket, String token, Instant now) {
        try {
            return transactionTemplate.execute(status -> {
                Optional<RebalanceBucket> existing = bucketRepository.findById(bucket);
                if (existing.isEmpty()) {
                    bucketRepository.saveAndFlush(RebalanceBucket.builder()
                            .bucket(bucket)
                            .status(RebalanceBucket.Status.IN_PROGRESS)
                            .consistencyToken(token)
                            .startedAt(now)
                            .build());
                    return Optional.<RebalanceResult>empty();
                }
                RebalanceBucket marker = existing.get();
                if (marker.getStatus() == RebalanceBucket.Status.COMPLETED) {
                    return Optional.of(replay(marker));
                }
                boolean stale = marker.getStartedAt().isBefore(now.minus(properties.getRebalanceLockTimeout()));
                if (marker.getStatus() == RebalanceBucket.Status.IN_PROGRESS && !stale) {
                    throw new ConflictException("Rebalance for bucket " + bucket + " already in progress");
                }
                log.warn("Taking over rebalance bucket={} previousStatus={} startedAt={}", bucket, marker.getStatus(),
                        marker.getStartedAt());
                marker.setStatus(RebalanceBucket.Status.IN_PROGRESS);
                marker.setConsistencyToken(token);
                marker.setErrorMessage(null);
                marker.setStartedAt(now);
                bucketRepository.saveAndFlush(marker);
                return Optional.<RebalanceResult>empty();
            });
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
            return bucketRepository.findById(bucket)
                    .filter(marker -> marker.getStatus() == RebalanceBucket.Status.COMPLETED)
                    .map(this::replay)
                    .map(Optional::of)
                    .orElseThrow(() -> new ConflictException("Rebalance for bucket " + bucket + " already claimed"));
        }
    }

    private void markFailed(String bucket, RuntimeException cause) {
        try {
            transactionTemplate.executeWithoutResult(status -> bucketRepository.findById(bucket).ifPresent(marker -> {
                marker.setStatus(RebalanceBucket.Status.FAILED);
                marker.setConsistencyToken(null);
                marker.setErrorMessage(truncate(cause.getMessage()));
                marker.setCompletedAt(clock.instant());
                bucketRepository.save(marker);
            }));
        } catch (RuntimeException e) {
            log.error("Could not mark rebalance bucket {} as failed", bucket, e);
        }
        log.error("Rebalance failed bucket={}", bucket, cause);
    }

    private RebalanceResult replay(RebalanceBucket marker) {
        auditEventService.record(AuditAction.REBALANCE_REPLAYED, marker.getBucket(),
                "Rebalance served from recorded bucket result", null);
        try {
            RebalanceResult recorded = objectMapper.readValue(marker.getResultJson(), RebalanceResult.class);
            return recorded.toBuilder().replayed(true).build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConflictException("Recorded rebalance result for " + marker.getBucket() + " is unreadable");
        }
    }

    private Allocation replayStage(Allocation existing) {
        auditEventService.record(AuditAction.ALLOCATION_STAGE_REPLAYED, existing.getId(),
                "Stage served from existing allocation", Map.of("consistencyToken", existing.getConsistencyToken()));
        return existing;
    }

    private void requireFreshMarketData() {
        Instant now = clock.instant();
        Optional<Instant> lastQuote = marketRecorderService.latestQuoteReceivedAt();
        if (lastQuote.isEmpty()) {
            throw new FailClosedException("NBBO_STALE", "no quotes recorded", "Cannot stage without recent NBBO data");
        }
        Duration age = Duration.between(lastQuote.get(), now);
        if (age.compareTo(properties.getNbboMaxAge()) > 0) {
            throw new FailClosedException("NBBO_STALE", "last quote " + age.toSeconds() + "s old",
                    "Cannot stage without recent NBBO data");
        }
    }

    private static void validate(StageRequest request) {
        if (request == null) {
            throw new BadRequestException("Stage request is required");
        }
        if (isBlank(request.getSessionId()) || isBlank(request.getStrategyRef())
                || isBlank(request.getConsistencyToken())) {
            throw new BadRequestException("sessionId, strategyRef and consistencyToken are required");
        }
        Double allocation = request.getAllocation();
        if (allocation == null || allocation.isNaN() || allocation <= 0 || allocation > 1) {
            throw new BadRequestException("allocation must be within (0, 1]");
        }
        if (request.getTtlDays() != null && request.getTtlDays() <= 0) {
            throw new BadRequestException("ttlDays must be positive");
        }
    }

    private Map<String, Position> positions(List<Allocation> allocations) {
        List<String> ids = allocations.stream().map(Allocation::getId).toList();
        Map<String, List<FillSnapshot>> fillsByAllocation = marketRecorderService.fillsForAllocations(ids).stream()
                .collect(Collectors.groupingBy(FillSnapshot::getAllocationId, LinkedHashMap::new, Collectors.toList()));
        Map<String, Optional<QuoteSnapshot>> marks = new HashMap<>();
        Map<String, Position> positions = new HashMap<>();
        fillsByAllocation.forEach((allocationId, fills) -> {
            Position total = Position.EMPTY;
            Map<String, List<FillSnapshot>> bySymbol = fills.stream()
                    .collect(Collectors.groupingBy(FillSnapshot::getSymbol, LinkedHashMap::new, Collectors.toList()));
            for (Map.Entry<String, List<FillSnapshot>> entry : bySymbol.entrySet()) {
                Optional<QuoteSnapshot> mark = marks.computeIfAbsent(entry.getKey(), marketRecorderService::latestQuote);
                total = total.plus(averageCost(entry.getValue(), mark.map(QuoteSnapshot::getBid).orElse(null)));
            }
            positions.put(allocationId, total);
        });
        return positions;
    }

    /**
     * Average-cost PnL of one symbol's fills, with the open remainder marked at {@code bid}.
     */
    static Position averageCost(List<FillSnapshot> fills, Double bid) {
        int quantity = 0;
        BigDecimal cost = MoneyUtils.ZERO;
        BigDecimal realized = MoneyUtils.ZERO;
        for (FillSnapshot fill : fills) {
            String side = fill.getSide() == null ? "" : fill.getSide().toUpperCase();
            if (side.startsWith("BUY")) {
                cost = MoneyUtils.add(cost, MoneyUtils.add(MoneyUtils.multiply(fill.getPrice(), fill.getQuantity()),
                        fill.getFees()));
                quantity += fill.getQuantity();
            } else if (side.startsWith("SELL") && quantity > 0) {
                int closed = Math.min(fill.getQuantity(), quantity);
                BigDecimal avg = cost.divide(BigDecimal.valueOf(quantity), 8, RoundingMode.HALF_UP);
                BigDecimal basis = MoneyUtils.scale(avg.multiply(BigDecimal.valueOf(closed)));
                BigDecimal proceeds = MoneyUtils.subtract(MoneyUtils.multiply(fill.getPrice(), closed), fill.getFees());
                realized = MoneyUtils.add(realized, MoneyUtils.subtract(proceeds, basis));
                cost = MoneyUtils.subtract(cost, basis);
                quantity -= closed;
            }
        }
        BigDecimal unrealized = MoneyUtils.ZERO;
        if (quantity > 0 && bid != null) {
            unrealized = MoneyUtils.subtract(MoneyUtils.multiply(MoneyUtils.bd(bid), quantity), cost);
        }
        return new Position(quantity, realized, unrealized);
    }

    private String toJson(RebalanceResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rebalance result", e);
        }
    }

    private static double sum(List<Allocation> allocations) {
        return allocations.stream().mapToDouble(Allocation::getAllocation).sum();
    }

    private static String riskLevel(double utilization) {
        if (utilization >= 0.9) {
            return "HIGH";
        }
        if (utilization >= 0.6) {
            return "MEDIUM";
        }
        return "LOW";
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 512 ? message : message.substring(0, 512);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record Position(int openQuantity, BigDecimal realized, BigDecimal unrealized) {

        static final Position EMPTY = new Position(0, MoneyUtils.ZERO, MoneyUtils.ZERO);

        Position plus(Position other) {
            return new Position(openQuantity + other.openQuantity, MoneyUtils.add(realized, other.realized),
                    MoneyUtils.add(unrealized, other.unrealized));
        }
    }
}
