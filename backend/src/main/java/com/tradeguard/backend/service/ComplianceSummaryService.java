package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AuditProperties;
import com.tradeguard.backend.config.ComplianceProperties;
import com.tradeguard.backend.dto.ComplianceSummary;
import com.tradeguard.backend.model.ProofRecord;
import com.tradeguard.backend.model.QuoteSnapshot;
import com.tradeguard.backend.service.marketdata.FrictionStats;
import com.tradeguard.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Windowed compliance view over recorded proofs, quotes and fills.
 * Windows are half-open {@code [from, to)}; an empty window passes every metric.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ComplianceSummaryService {

    static final String UNROUTED = "UNROUTED";

    private final MarketRecorderService marketRecorderService;
    private final ComplianceProperties properties;
    private final AuditProperties auditProperties;
    private final Clock clock;

    public ComplianceSummary summarizeTrailing() {
        return summarizeTrailing(properties.getWindow());
    }

    public ComplianceSummary summarizeTrailing(Duration window) {
        Instant to = clock.instant();
        return summarize(to.minus(window), to);
    }

    public ComplianceSummary summarize(Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new IllegalArgumentException("Compliance window must satisfy from < to");
        }
        try {
            return compute(from, to);
        } catch (RuntimeException e) {
            log.warn("Compliance summary unavailable for [{}, {}): {}", from, to, e.getMessage());
            return unavailable(from, to, e);
        }
    }

    private ComplianceSummary compute(Instant from, Instant to) {
        List<ProofRecord> proofs = marketRecorderService.proofsInWindow(from, to);
        List<QuoteSnapshot> quotes = marketRecorderService.quotesInWindow(from, to);
        FrictionStats friction = marketRecorderService.frictionStats(from, to,
                properties.getFriction20Threshold(), properties.getFriction25Threshold());

        int withNbbo = (int) proofs.stream().filter(proof -> !proof.isUsingFallback()).count();
        int passedProofs = (int) proofs.stream().filter(ProofRecord::isPassed).count();
        int conforming = (int) proofs.stream().filter(ProofRecord::isSlippageWithinPlan).count();
        int critical = (int) proofs.stream().filter(ProofRecord::isCriticalHeadroomAlert).count();

        ComplianceSummary.Metric nbbo = metric(proofs.size(), withNbbo, properties.getMinNbboFreshness());
        ComplianceSummary.Metric latency = metric(quotes.size(), countLowLatency(quotes), null);
        ComplianceSummary.Metric friction20 = metric(friction.totalFills(), friction.within20Count(),
                properties.getMinFriction20());
        ComplianceSummary.Metric friction25 = metric(friction.totalFills(), friction.within25Count(),
                properties.getMinFriction25());
        ComplianceSummary.Metric passRate = metric(proofs.size(), passedProofs, properties.getMinProofPassRate());
        ComplianceSummary.Metric slippage = metric(proofs.size(), conforming, properties.getMinSlippageConformance());

        List<String> reasons = new ArrayList<>();
        addReason(reasons, "NBBO_FRESHNESS_INSUFFICIENT", nbbo);
        addReason(reasons, "FRICTION_20PCT_INSUFFICIENT", friction20);
        addReason(reasons, "FRICTION_25PCT_INSUFFICIENT", friction25);
        addReason(reasons, "SLIPPAGE_CONFORMANCE_INSUFFICIENT", slippage);
        addReason(reasons, "PROOF_PASS_RATE_INSUFFICIENT", passRate);

        ComplianceSummary summary = ComplianceSummary.builder()
                .from(from)
                .to(to)
                .windowHours(Duration.between(from, to).toHours())
                .nbboFreshness(nbbo)
                .quoteLatency(latency)
                .friction20(friction20)
                .friction25(friction25)
                .avgFriction(MoneyUtils.round(friction.avgFriction(), 6))
                .proofPassRate(passRate)
                .slippageConformance(slippage)
                .criticalHeadroomAlerts(critical)
                .routes(routeBreakdown(proofs))
                .passed(reasons.isEmpty())
                .reasons(List.copyOf(reasons))
                .dataAvailable(true)
                .build();
        return summary.toBuilder().summary(render(summary)).build();
    }

    public String render(ComplianceSummary summary) {
        StringBuilder text = new StringBuilder();
        text.append("Temporal Proof (").append(summary.windowHours()).append("h): ")
                .append(summary.passed() ? "PASSED" : "FAILED").append('\n');
        if (!summary.dataAvailable()) {
            text.append("  data unavailable\n");
        } else {
            appendMetric(text, "NBBO freshness", summary.nbboFreshness());
            appendMetric(text, "Friction <= 20%", summary.friction20());
            appendMetric(text, "Friction <= 25%", summary.friction25());
            appendMetric(text, "Slippage conformance", summary.slippageConformance());
            appendMetric(text, "Proof pass rate", summary.proofPassRate());
            appendMetric(text, "Quote latency", summary.quoteLatency());
            if (summary.criticalHeadroomAlerts() > 0) {
                text.append("  critical headroom alerts: ").append(summary.criticalHeadroomAlerts()).append('\n');
            }
        }
        for (String reason : summary.reasons()) {
            text.append("  - ").append(reason).append('\n');
        }
        return text.toString();
    }

    private int countLowLatency(List<QuoteSnapshot> quotes) {
        Duration maxAge = auditProperties.getQuoteMaxAge();
        int fresh = 0;
        for (QuoteSnapshot quote : quotes) {
            if (quote.getTsFeed() != null
                    && Duration.between(quote.getTsFeed(), quote.getTsRecv()).compareTo(maxAge) <= 0) {
                fresh++;
            }
        }
        return fresh;
    }

    private Map<String, ComplianceSummary.RouteBreakdown> routeBreakdown(List<ProofRecord> proofs) {
        Map<String, List<ProofRecord>> byRoute = new TreeMap<>();
        for (ProofRecord proof : proofs) {
            String route = proof.getRoute() == null || proof.getRoute().isBlank() ? UNROUTED : proof.getRoute();
            byRoute.computeIfAbsent(route, key -> new ArrayList<>()).add(proof);
        }
        Map<String, ComplianceSummary.RouteBreakdown> breakdown = new LinkedHashMap<>();
        byRoute.forEach((route, records) -> {
            int passed = (int) records.stream().filter(ProofRecord::isPassed).count();
            int fallback = (int) records.stream().filter(ProofRecord::isUsingFallback).count();
            OptionalDouble average = records.stream()
                    .filter(record -> record.getRealSlippage() != null)
                    .mapToDouble(ProofRecord::getRealSlippage)
                    .average();
            Double avgSlippage = average.isPresent() ? MoneyUtils.round(average.getAsDouble(), 6) : null;
            breakdown.put(route, new ComplianceSummary.RouteBreakdown(records.size(), passed,
                    MoneyUtils.round(passed / (double) records.size(), 4), avgSlippage, fallback));
        });
        return breakdown;
    }

    private ComplianceSummary unavailable(Instant from, Instant to, RuntimeException error) {
        ComplianceSummary.Metric empty = new ComplianceSummary.Metric(0, 0, 0.0, null, false);
        ComplianceSummary summary = ComplianceSummary.builder()
                .from(from)
                .to(to)
                .windowHours(Duration.between(from, to).toHours())
                .nbboFreshness(empty)
                .quoteLatency(empty)
                .friction20(empty)
                .friction25(empty)
                .avgFriction(0.0)
                .proofPassRate(empty)
                .slippageConformance(empty)
                .criticalHeadroomAlerts(0)
                .routes(Map.of())
                .passed(false)
                .reasons(List.of("DATA_UNAVAILABLE: " + error.getMessage()))
                .dataAvailable(false)
                .build();
        return summary.toBuilder().summary(render(summary)).build();
    }

    private static ComplianceSummary.Metric metric(int total, int compliant, Double threshold) {
        double ratio = total == 0 ? 1.0 : compliant / (double) total;
        boolean passed = threshold == null || ratio >= threshold;
        return new ComplianceSummary.Metric(total, compliant, MoneyUtils.round(ratio, 4), threshold, passed);
    }

    private static void addReason(List<String> reasons, String code, ComplianceSummary.Metric metric) {
        if (!metric.passed()) {
            reasons.add(String.format(Locale.ROOT, "%s: %.1f%% < %.1f%%", code, metric.ratio() * 100,
                    metric.threshold() * 100));
        }
    }

    private static void appendMetric(StringBuilder text, String label, ComplianceSummary.Metric metric) {
        text.append(String.format(Locale.ROOT, "  %s: %.1f%% (%d/%d)%s\n", label, metric.ratio() * 100,
                metric.compliant(), metric.total(), metric.threshold() == null ? "" : metric.passed() ? " OK" : " FAIL"));
    }
}
