package com.tradeguard.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.backend.config.AuditProperties;
import com.tradeguard.backend.dto.AuditStamp;
import com.tradeguard.backend.model.AuditTrailEntry;
import com.tradeguard.backend.model.ChainLegSnapshot;
import com.tradeguard.backend.model.FillSnapshot;
import com.tradeguard.backend.model.LedgerSnapshot;
import com.tradeguard.backend.model.OrderSnapshot;
import com.tradeguard.backend.model.ProofRecord;
import com.tradeguard.backend.model.QuoteSnapshot;
import com.tradeguard.backend.repository.AuditTrailRepository;
import com.tradeguard.backend.repository.ChainLegSnapshotRepository;
import com.tradeguard.backend.repository.FillSnapshotRepository;
import com.tradeguard.backend.repository.LedgerSnapshotRepository;
import com.tradeguard.backend.repository.OrderSnapshotRepository;
import com.tradeguard.backend.repository.ProofRecordRepository;
import com.tradeguard.backend.repository.QuoteSnapshotRepository;
import com.tradeguard.backend.service.marketdata.ChainLegTick;
import com.tradeguard.backend.service.marketdata.FillEvent;
import com.tradeguard.backend.service.marketdata.FrictionStats;
import com.tradeguard.backend.service.marketdata.LedgerChange;
import com.tradeguard.backend.service.marketdata.OrderPlan;
import com.tradeguard.backend.service.marketdata.QuoteTick;
import com.tradeguard.backend.trading.proof.ExecutionEvidence;
import com.tradeguard.backend.trading.proof.NbboQuote;
import com.tradeguard.backend.trading.proof.Proof;
import com.tradeguard.backend.trading.proof.ProofReason;
import com.tradeguard.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Write-once store of market, order, fill, ledger and proof records.
 * <p>
 * Writes are best-effort: each runs on the audit executor, inserts the record
 * and its provenance stamp in one transaction, and is bounded by
 * {@code audit.write-timeout}. A failed or late write is logged and counted,
 * and the returned future completes with an empty result. Reads are synchronous.
 */
@Slf4j
@Service
public class MarketRecorderService implements ExecutionEvidence {

    private final QuoteSnapshotRepository quoteRepository;
    private final ChainLegSnapshotRepository chainRepository;
    private final OrderSnapshotRepository orderRepository;
    private final FillSnapshotRepository fillRepository;
    private final LedgerSnapshotRepository ledgerRepository;
    private final ProofRecordRepository proofRepository;
    private final AuditTrailRepository auditTrailRepository;
    private final AuditStampFactory auditStampFactory;
    private final AuditProperties auditProperties;
    private final MetricsService metricsService;
    private final TransactionTemplate transactionTemplate;
    private final Executor auditExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MarketRecorderService(QuoteSnapshotRepository quoteRepository,
                                 ChainLegSnapshotRepository chainRepository,
                                 OrderSnapshotRepository orderRepository,
                                 FillSnapshotRepository fillRepository,
                                 LedgerSnapshotRepository ledgerRepository,
                                 ProofRecordRepository proofRepository,
                                 AuditTrailRepository auditTrailRepository,
                                 AuditStampFactory auditStampFactory,
                                 AuditProperties auditProperties,
                                 MetricsService metricsService,
                                 TransactionTemplate transactionTemplate,
                                 @Qualifier("auditExecutor") Executor auditExecutor,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.quoteRepository = quoteRepository;
        this.chainRepository = chainRepository;
        this.orderRepository = orderRepository;
        this.fillRepository = fillRepository;
        this.ledgerRepository = ledgerRepository;
        this.proofRepository = proofRepository;
        this.auditTrailRepository = auditTrailRepository;
        this.auditStampFactory = auditStampFactory;
        this.auditProperties = auditProperties;
        this.metricsService = metricsService;
        this.transactionTemplate = transactionTemplate;
        this.auditExecutor = auditExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public CompletableFuture<Optional<Long>> recordQuote(QuoteTick tick) {
        return write(AuditTrailEntry.RecordType.QUOTE, () -> {
            Instant received = tick.tsRecv() != null ? tick.tsRecv() : clock.instant();
            QuoteSnapshot saved = quoteRepository.save(QuoteSnapshot.builder()
                    .symbol(tick.symbol())
                    .bid(tick.bid())
                    .ask(tick.ask())
                    .mid(tick.mid())
                    .tsFeed(tick.tsFeed())
                    .tsRecv(received)
                    .source(tick.source())
                    .build());
            return new Written(saved.getId(), saved.getTsFeed(), saved.getTsRecv());
        });
    }

    public CompletableFuture<Optional<Long>> recordChain(ChainLegTick leg) {
        return write(AuditTrailEntry.RecordType.CHAIN, () -> {
            Instant received = leg.tsRecv() != null ? leg.tsRecv() : clock.instant();
            ChainLegSnapshot saved = chainRepository.save(ChainLegSnapshot.builder()
                    .symbol(leg.symbol())
                    .expiry(leg.expiry())
                    .strike(leg.strike())
                    .optionType(leg.optionType())
                    .bid(leg.bid())
                    .ask(leg.ask())
                    .openInterest(leg.openInterest())
                    .volume(leg.volume())
                    .delta(leg.delta())
                    .gamma(leg.gamma())
                    .theta(leg.theta())
                    .vega(leg.vega())
                    .rho(leg.rho())
                    .iv(leg.iv())
                    .tsFeed(leg.tsFeed())
                    .tsRecv(received)
                    .source(leg.source())
                    .build());
            return new Written(saved.getId(), saved.getTsFeed(), saved.getTsRecv());
        });
    }

    public CompletableFuture<Optional<Long>> recordOrder(OrderPlan plan) {
        return write(AuditTrailEntry.RecordType.ORDER, () -> {
            OrderSnapshot saved = orderRepository.save(OrderSnapshot.builder()
                    .planId(plan.planId())
                    .symbol(plan.symbol())
                    .route(plan.route())
                    .ladders(toJson(plan.ladders()))
                    .plannedMaxSlip(plan.plannedMaxSlip())
                    .tsCreated(plan.createdAt() != null ? plan.createdAt() : clock.instant())
                    .build());
            return new Written(saved.getId(), null, saved.getTsCreated());
        });
    }

    public CompletableFuture<Optional<Long>> recordFill(FillEvent fill) {
        return write(AuditTrailEntry.RecordType.FILL, () -> {
            FillSnapshot saved = fillRepository.save(FillSnapshot.builder()
                    .planId(fill.planId())
                    .symbol(fill.symbol())
                    .side(fill.side())
                    .price(MoneyUtils.scale(fill.price()))
                    .quantity(fill.quantity())
                    .fees(MoneyUtils.scale(fill.fees() == null ? MoneyUtils.ZERO : fill.fees()))
                    .tsFill(fill.tsFill() != null ? fill.tsFill() : clock.instant())
                    .brokerAttestation(fill.brokerAttestation())
                    .allocationId(fill.allocationId())
                    .build());
            return new Written(saved.getId(), null, saved.getTsFill());
        });
    }

    public CompletableFuture<Optional<Long>> recordLedgerChange(LedgerChange change) {
        return write(AuditTrailEntry.RecordType.LEDGER, () -> {
            LedgerSnapshot saved = ledgerRepository.save(LedgerSnapshot.builder()
                    .cashBefore(MoneyUtils.scale(change.cashBefore()))
                    .cashAfter(MoneyUtils.scale(change.cashAfter()))
                    .changeReason(change.reason())
                    .planId(change.planId())
                    .tsChange(change.at() != null ? change.at() : clock.instant())
                    .build());
            return new Written(saved.getId(), null, saved.getTsChange());
        });
    }

    public CompletableFuture<Optional<Long>> recordProof(Proof proof, String route) {
        return write(AuditTrailEntry.RecordType.PROOF, () -> {
            ProofRecord saved = proofRepository.save(ProofRecord.builder()
                    .tradeId(proof.tradeId() != null ? proof.tradeId() : "unknown")
                    .planId(proof.planId())
                    .symbol(proof.symbol())
                    .route(route)
                    .passed(proof.overall().passed())
                    .usingFallback(proof.usingFallback())
                    .slippageWithinPlan(proof.slippageWithinPlan().passed())
                    .realSlippage(proof.realSlippage())
                    .criticalHeadroomAlert(proof.criticalHeadroomAlert())
                    .reasons(truncate(proof.overall().reasons().stream()
                            .map(ProofReason::toString)
                            .collect(Collectors.joining("; ")), 4000))
                    .proofJson(toJson(proof))
                    .verifiedAt(proof.verifiedAt())
                    .build());
            return new Written(saved.getId(), null, saved.getVerifiedAt());
        });
    }

    public Optional<QuoteSnapshot> latestFreshQuote(String symbol) {
        return latestFreshQuote(symbol, auditProperties.getQuoteMaxAge());
    }

    public Optional<QuoteSnapshot> latestFreshQuote(String symbol, Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        return quoteRepository.findFirstBySymbolOrderByTsRecvDesc(symbol)
                .filter(quote -> !quote.getTsRecv().isBefore(cutoff));
    }

    public Optional<QuoteSnapshot> latestQuote(String symbol) {
        return quoteRepository.findFirstBySymbolOrderByTsRecvDesc(symbol);
    }

    public Optional<Instant> latestQuoteReceivedAt() {
        return quoteRepository.findFirstByOrderByTsRecvDesc().map(QuoteSnapshot::getTsRecv);
    }

    /**
     * Quote nearest to {@code timestamp} by receive time, within the tolerance on
     * either side (inclusive). On equal distance the earlier quote wins.
     */
    @Override
    public Optional<NbboQuote> nbboAt(String symbol, Instant timestamp, Duration tolerance) {
        if (symbol == null || timestamp == null) {
            return Optional.empty();
        }
        List<QuoteSnapshot> candidates = quoteRepository.findBySymbolAndTsRecvBetweenOrderByTsRecvAsc(
                symbol, timestamp.minus(tolerance), timestamp.plus(tolerance));
        QuoteSnapshot nearest = null;
        long nearestDistance = Long.MAX_VALUE;
        for (QuoteSnapshot quote : candidates) {
            long distance = Math.abs(Duration.between(timestamp, quote.getTsRecv()).toNanos());
            if (distance < nearestDistance) {
                nearest = quote;
                nearestDistance = distance;
            }
        }
        return Optional.ofNullable(nearest)
                .map(quote -> new NbboQuote(quote.getSymbol(), quote.getBid(), quote.getAsk(), quote.getMid(),
                        quote.getTsRecv()));
    }

    @Override
    public Optional<Double> plannedMaxSlippage(String planId) {
        return orderForPlan(planId).map(OrderSnapshot::getPlannedMaxSlip);
    }

    public Optional<OrderSnapshot> orderForPlan(String planId) {
        return orderRepository.findFirstByPlanIdOrderByTsCreatedDesc(planId);
    }

    public List<FillSnapshot> fillsForPlan(String planId) {
        return fillRepository.findByPlanIdOrderByTsFillAsc(planId);
    }

    public List<FillSnapshot> fillsForAllocations(Collection<String> allocationIds) {
        if (allocationIds.isEmpty()) {
            return List.of();
        }
        return fillRepository.findByAllocationIdInOrderByTsFillAsc(allocationIds);
    }

    public List<FillSnapshot> fillsInWindow(Instant from, Instant to) {
        return fillRepository.findByTsFillGreaterThanEqualAndTsFillLessThanOrderByTsFillAsc(from, to);
    }

    public List<LedgerSnapshot> ledgerChanges(Instant from, Instant to) {
        return ledgerRepository.findByTsChangeGreaterThanEqualAndTsChangeLessThanOrderByTsChangeAsc(from, to);
    }

    public Optional<LedgerSnapshot> latestLedger() {
        return ledgerRepository.findFirstByOrderByTsChangeDesc();
    }

    public List<QuoteSnapshot> quotesInWindow(Instant from, Instant to) {
        return quoteRepository.findByTsRecvGreaterThanEqualAndTsRecvLessThanOrderByTsRecvAsc(from, to);
    }

    public List<ProofRecord> proofsInWindow(Instant from, Instant to) {
        return proofRepository.findByVerifiedAtGreaterThanEqualAndVerifiedAtLessThanOrderByVerifiedAtAsc(from, to);
    }

    /**
     * Fee-to-notional ratio of every fill in {@code [from, to)}, counted against two
     * thresholds. A fill with no notional counts as non-compliant.
     */
    public FrictionStats frictionStats(Instant from, Instant to, double lowThreshold, double highThreshold) {
        List<FillSnapshot> fills = fillsInWindow(from, to);
        if (fills.isEmpty()) {
            return FrictionStats.EMPTY;
        }
        double sum = 0.0;
        int measured = 0;
        int withinLow = 0;
        int withinHigh = 0;
        for (FillSnapshot fill : fills) {
            BigDecimal notional = MoneyUtils.multiply(fill.getPrice(), fill.getQuantity()).abs();
            if (notional.signum() == 0) {
                continue;
            }
            double friction = MoneyUtils.toDouble(fill.getFees()) / MoneyUtils.toDouble(notional);
            sum += friction;
            measured++;
            if (friction <= lowThreshold) {
                withinLow++;
            }
            if (friction <= highThreshold) {
                withinHigh++;
            }
        }
        double average = measured == 0 ? 0.0 : sum / measured;
        return new FrictionStats(fills.size(), average, withinLow, withinHigh);
    }

    private CompletableFuture<Optional<Long>> write(AuditTrailEntry.RecordType type, Supplier<Written> insert) {
        CompletableFuture<Long> pending;
        try {
            pending = CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> {
                Written written = insert.get();
                auditTrailRepository.save(trailEntry(type, written));
                return written.id();
            }), auditExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(failed(type, e));
        }
        return pending
                .orTimeout(auditProperties.getWriteTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(Optional::ofNullable)
                .exceptionally(ex -> failed(type, ex));
    }

    private AuditTrailEntry trailEntry(AuditTrailEntry.RecordType type, Written written) {
        AuditStamp stamp = auditStampFactory.stamp();
        return AuditTrailEntry.builder()
                .recordType(type)
                .recordId(written.id())
                .tsFeed(written.tsFeed())
                .tsRecv(written.tsRecv())
                .serverTs(stamp.serverTs())
                .commitHash(stamp.commitHash())
                .policyHash(stamp.policyHash())
                .environment(stamp.environment())
                .wormMode(stamp.wormMode())
                .build();
    }

    private Optional<Long> failed(AuditTrailEntry.RecordType type, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.warn("Audit write failed type={} error={}", type, cause.toString());
        metricsService.recordAuditWriteFailure(type.name());
        return Optional.empty();
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit payload", e);
        }
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private record Written(Long id, Instant tsFeed, Instant tsRecv) {}
}
