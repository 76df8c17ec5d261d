package com.tradeguard.backend.trading.proof;

import com.tradeguard.backend.config.ProverProperties;
import com.tradeguard.backend.dto.AuditStamp;
import com.tradeguard.backend.service.AuditStampFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Verifies an executed trade against the promise made before it was sent.
 * <p>
 * Every sub-proof is computed independently and the overall result is the
 * conjunction of all of them. A missing or malformed promise or fact makes the
 * trade unproven: the integrity check fails and no other check is evaluated.
 */
@Slf4j
@Component
public class PostTradeProver {

    static final List<String> GREEKS = List.of("delta", "theta", "vega");
    static final String FORBIDDEN_SIDE = "SELL_TO_OPEN";
    static final String REQUIRED_ENTRY_SIDE = "BUY_TO_OPEN";

    private final ProverProperties properties;
    private final ExecutionEvidence evidence;
    private final AuditStampFactory auditStampFactory;
    private final Clock clock;
    private final HeadroomAlertTracker headroomTracker;

    @Autowired
    public PostTradeProver(ProverProperties properties, ExecutionEvidence evidence,
                           AuditStampFactory auditStampFactory, Clock clock) {
        this(properties, evidence, auditStampFactory, clock, HeadroomAlertTracker.from(properties, clock.instant()));
    }

    public PostTradeProver(ProverProperties properties, ExecutionEvidence evidence,
                           AuditStampFactory auditStampFactory, Clock clock, HeadroomAlertTracker headroomTracker) {
        this.properties = properties;
        this.evidence = evidence;
        this.auditStampFactory = auditStampFactory;
        this.clock = clock;
        this.headroomTracker = headroomTracker;
    }

    public Proof verifyExecution(PreTradePromise promise, PostTradeFact fact) {
        Instant verifiedAt = clock.instant();
        AuditStamp stamp = auditStampFactory.stamp();
        ProofCheck integrity = proveIntegrity(promise, fact);
        String tradeId = fact != null ? fact.id() : null;
        String planId = fact != null ? fact.planIdOrId() : null;
        String symbol = fact != null ? fact.symbol() : null;

        if (!integrity.passed()) {
            log.warn("Trade {} unproven: {}", tradeId, integrity.reasons());
            ProofCheck skipped = ProofCheck.notEvaluated();
            return new Proof(tradeId, planId, symbol, verifiedAt, stamp, integrity,
                    skipped, skipped, skipped, skipped, skipped, skipped, skipped, skipped,
                    Proof.aggregate(List.of(integrity)), false, false, null);
        }

        ProofCheck execution = proveExecutionBounds(promise, fact);
        ProofCheck structure = proveStructureBounds(promise, fact);
        ProofCheck cash = proveCashBounds(promise, fact);
        GreeksOutcome greeks = proveGreeksDrift(promise, fact, verifiedAt);
        ProofCheck netDebitOnly = proveNetDebitOnly(fact);
        ProofCheck sidesOk = proveSidesOk(fact);
        SlippageOutcome slippage = proveSlippageWithinPlan(promise, fact);
        ProofCheck caps = proveGreeksCapsWithin(promise, fact);

        Proof.Overall overall = Proof.aggregate(List.of(integrity, execution, structure, cash, greeks.check(),
                netDebitOnly, sidesOk, slippage.check(), caps));
        Proof proof = new Proof(tradeId, planId, symbol, verifiedAt, stamp, integrity, execution, structure, cash,
                greeks.check(), netDebitOnly, sidesOk, slippage.check(), caps, overall,
                greeks.critical(), slippage.usingFallback(), slippage.realSlippage());
        if (!overall.passed()) {
            log.info("Trade {} failed post-trade proof: {}", tradeId, overall.reasons());
        }
        return proof;
    }

    ProofCheck proveIntegrity(PreTradePromise promise, PostTradeFact fact) {
        ProofCheck.Builder check = ProofCheck.builder();
        if (promise == null) {
            check.fail("PROMISE_MISSING", "no pre-trade promise recorded for this trade");
        } else {
            if (isBlank(promise.optionType())) {
                check.fail("PROMISE_MALFORMED", "promise has no option type");
            }
            if (promise.sizing() == null || !positive(promise.sizing().notional())) {
                check.fail("PROMISE_MALFORMED", "promise has no positive notional");
            }
            if (promise.structure() == null || !finite(promise.structure().netDebit())) {
                check.fail("PROMISE_MALFORMED", "promise has no net debit");
            }
            if (promise.executionPlan() != null && promise.executionPlan().maxSlippage() != null
                    && !(promise.executionPlan().maxSlippage() > 0)) {
                check.fail("PROMISE_MALFORMED", "promise max slippage must be positive");
            }
        }
        if (fact == null) {
            check.fail("FACT_MISSING", "no execution fact supplied");
        } else {
            if (isBlank(fact.id()) || isBlank(fact.symbol())) {
                check.fail("FACT_MALFORMED", "fact needs an id and a symbol");
            }
            if (!positive(fact.price()) || fact.qty() == null || fact.qty() <= 0) {
                check.fail("FACT_MALFORMED", "fact needs a positive price and quantity");
            }
            if (fact.timestamp() == null) {
                check.fail("FACT_MALFORMED", "fact has no fill timestamp");
            }
            if (!finite(fact.netDebit()) || !finite(fact.totalCost())) {
                check.fail("FACT_MALFORMED", "fact needs net debit and total cost");
            }
        }
        return check.build();
    }

    ProofCheck proveExecutionBounds(PreTradePromise promise, PostTradeFact fact) {
        ProofCheck.Builder check = ProofCheck.builder();
        double planned = promisedMaxSlippage(promise);
        double bound = planned * properties.getSlippageMultiplier();
        check.detail("plannedSlippage", planned);

        if (!finite(fact.actualSlippage())) {
            check.fail("SLIPPAGE_UNKNOWN", "execution reported no slippage");
        } else {
            double actual = fact.actualSlippage();
            check.detail("actualSlippage", actual);
            if (actual > bound) {
                check.fail("SLIPPAGE_EXCEEDED", String.format(Locale.ROOT, "%.3f > %.3f", actual, bound));
            }
        }

        if (fact.requestedQty() == null || fact.requestedQty() <= 0) {
            check.fail("INSUFFICIENT_FILL", "requested quantity unknown, fill ratio cannot be verified");
        } else {
            double fillPct = fact.qty() / (double) fact.requestedQty();
            check.detail("fillPct", fillPct);
            if (fillPct < properties.getMinFillPct()) {
                check.fail("INSUFFICIENT_FILL", String.format(Locale.ROOT, "%.1f%% < %.1f%%",
                        fillPct * 100, properties.getMinFillPct() * 100));
            }
        }
        return check.build();
    }

    ProofCheck proveStructureBounds(PreTradePromise promise, PostTradeFact fact) {
        ProofCheck.Builder check = ProofCheck.builder();
        double promised = promise.structure().netDebit();
        // a close receives the premium back, so only its size is compared
        double actual = fact.isEntry() ? fact.netDebit() : Math.abs(fact.netDebit());
        check.detail("promisedNetDebit", promised).detail("actualNetDebit", actual);

        if (Math.abs(actual - promised) > properties.getNetDebitTolerance()) {
            check.fail("NET_DEBIT_MISMATCH", String.format(Locale.ROOT, "promised $%.2f, actual $%.2f", promised, actual));
        }
        if (fact.isEntry() && actual < 0) {
            check.fail("CREDIT_EXECUTED", String.format(Locale.ROOT,
                    "$%.2f credit violates cash-only policy", actual));
        }
        if (!promise.optionType().equalsIgnoreCase(String.valueOf(fact.optionType()))) {
            check.fail("STRUCTURE_MISMATCH", "promised " + promise.optionType() + ", executed " + fact.optionType());
        }
        return check.build();
    }

    ProofCheck proveCashBounds(PreTradePromise promise, PostTradeFact fact) {
        ProofCheck.Builder check = ProofCheck.builder();
        double promisedCost = promise.sizing().notional();
        double actualCost = fact.totalCost();
        double tolerance = promisedCost * properties.getCostTolerancePct();
        check.detail("promisedCost", promisedCost).detail("actualCost", actualCost);

        if (Math.abs(actualCost - promisedCost) > tolerance) {
            check.fail("COST_MISMATCH", String.format(Locale.ROOT, "promised $%.2f, actual $%.2f (tolerance $%.2f)",
                    promisedCost, actualCost, tolerance));
        }
        if (!finite(fact.cashAfter())) {
            check.fail("CASH_UNVERIFIED", "post-trade cash not reported");
        } else if (fact.cashAfter() < 0) {
            check.fail("NEGATIVE_CASH", String.format(Locale.ROOT,
                    "post-trade cash $%.2f violates cash-only policy", fact.cashAfter()));
        }
        return check.build();
    }

    GreeksOutcome proveGreeksDrift(PreTradePromise promise, PostTradeFact fact, Instant at) {
        ProofCheck.Builder check = ProofCheck.builder();
        if (fact.portfolioGreeks() == null) {
            check.fail("GREEKS_UNAVAILABLE", "post-trade portfolio greeks not reported");
            return new GreeksOutcome(check.build(), false);
        }
        Greeks reserved = promise.sizing().greeks() != null ? promise.sizing().greeks() : Greeks.ZERO;
        Greeks actual = fact.portfolioGreeks();
        List<String> breached = new ArrayList<>();

        for (String greek : GREEKS) {
            double limit = limit(promise, greek);
            double reservedHeadroom = limit - Math.abs(reserved.get(greek));
            double actualHeadroom = limit - Math.abs(actual.get(greek));
            double denominator = Math.abs(reservedHeadroom) == 0.0 ? 1.0 : Math.abs(reservedHeadroom);
            double driftPct = Math.abs(actualHeadroom - reservedHeadroom) / denominator;
            check.detail(greek + "ReservedHeadroom", reservedHeadroom)
                    .detail(greek + "ActualHeadroom", actualHeadroom)
                    .detail(greek + "DriftPct", driftPct);

            String code = greek.toUpperCase(Locale.ROOT);
            if (actualHeadroom < reservedHeadroom * properties.getHeadroomBuffer()) {
                breached.add(greek);
                check.fail(code + "_HEADROOM_REDUCED", String.format(Locale.ROOT,
                        "actual(%.6f) < reserved(%.6f)", actualHeadroom, reservedHeadroom));
            }
            if (driftPct > properties.getGreeksDriftMax()) {
                check.fail(code + "_DRIFT_EXCEEDED", String.format(Locale.ROOT, "%.1f%% > %.1f%%",
                        driftPct * 100, properties.getGreeksDriftMax() * 100));
            }
        }

        boolean critical = false;
        if (!breached.isEmpty()) {
            HeadroomAlertTracker.Result result = headroomTracker.record(at);
            check.detail("sessionBreachCount", result.sessionCount());
            if (result.critical()) {
                critical = true;
                log.error("CRITICAL: greeks headroom below buffer {} times this session (since {}), trade={} greeks={}",
                        result.sessionCount(), headroomTracker.sessionStart(), fact.id(), breached);
            }
        }
        return new GreeksOutcome(check.build(), critical);
    }

    ProofCheck proveNetDebitOnly(PostTradeFact fact) {
        ProofCheck.Builder check = ProofCheck.builder();
        check.detail("actualNetDebit", fact.netDebit()).detail("entry", fact.isEntry());
        if (fact.isEntry() && fact.netDebit() < 0) {
            check.fail("CREDIT_EXECUTED", String.format(Locale.ROOT,
                    "$%.2f violates cash-only policy", fact.netDebit()));
        }
        return check.build();
    }

    ProofCheck proveSidesOk(PostTradeFact fact) {
        ProofCheck.Builder check = ProofCheck.builder();
        List<String> sides = fact.sides() == null ? List.of() : fact.sides();
        check.detail("sides", sides);
        if (sides.stream().anyMatch(FORBIDDEN_SIDE::equalsIgnoreCase)) {
            check.fail("FORBIDDEN_SIDE", String.join(", ", sides) + " contains shorting");
        }
        if (fact.isEntry() && sides.stream().noneMatch(REQUIRED_ENTRY_SIDE::equalsIgnoreCase)) {
            check.fail("MISSING_ENTRY_SIDE", "[" + String.join(", ", sides) + "] missing " + REQUIRED_ENTRY_SIDE);
        }
        return check.build();
    }

    SlippageOutcome proveSlippageWithinPlan(PreTradePromise promise, PostTradeFact fact) {
        ProofCheck.Builder check = ProofCheck.builder();
        String planId = fact.planIdOrId();
        double plannedMax = persistedPlannedSlippage(planId).orElse(promisedMaxSlippage(promise));
        double bonus = isLeveragedEtf(fact.symbol()) ? properties.getLeveragedEtfBonus() : 0.0;
        double effectiveBound = (plannedMax + bonus) * properties.getSlippageMultiplier();
        check.detail("planId", planId).detail("plannedMax", plannedMax).detail("leveragedEtfBonus", bonus);

        Optional<NbboQuote> nbbo = lookupNbbo(fact);
        if (nbbo.isPresent() && nbbo.get().mid() > 0) {
            NbboQuote quote = nbbo.get();
            double price = fact.price();
            double realSlippage = Math.abs(price - quote.mid()) / quote.mid();
            check.detail("nbboMid", quote.mid()).detail("realSlippage", realSlippage)
                    .detail("effectiveBound", effectiveBound);
            if (realSlippage > effectiveBound) {
                check.fail("REAL_SLIPPAGE_EXCEEDED", String.format(Locale.ROOT,
                        "%.4f > %.4f (vs NBBO mid $%.2f)", realSlippage, effectiveBound, quote.mid()));
            }
            if (price < quote.bid() || price > quote.ask()) {
                check.fail("FILL_OUTSIDE_SPREAD", String.format(Locale.ROOT, "$%.2f outside [$%.2f, $%.2f]",
                        price, quote.bid(), quote.ask()));
            }
            return new SlippageOutcome(check.build(), false, realSlippage);
        }

        check.detail("usingFallback", true);
        if (properties.isRequireNbbo()) {
            check.fail("NBBO_UNAVAILABLE", "no NBBO within " + properties.getNbboTolerance().toMillis()
                    + "ms of fill at " + fact.timestamp());
        }
        double fallbackBound = plannedMax * properties.getSlippageMultiplier();
        if (!finite(fact.actualSlippage())) {
            check.fail("SLIPPAGE_UNVERIFIED", "no NBBO data and no reported slippage");
        } else if (fact.actualSlippage() > fallbackBound) {
            check.fail("SLIPPAGE_EXCEEDED", String.format(Locale.ROOT, "%.3f > %.3f (no NBBO data available)",
                    fact.actualSlippage(), fallbackBound));
        }
        return new SlippageOutcome(check.build(), true, null);
    }

    ProofCheck proveGreeksCapsWithin(PreTradePromise promise, PostTradeFact fact) {
        ProofCheck.Builder check = ProofCheck.builder();
        if (fact.portfolioGreeks() == null) {
            check.fail("GREEKS_UNAVAILABLE", "post-trade portfolio greeks not reported");
            return check.build();
        }
        double deltaMax = limit(promise, "delta");
        double thetaMax = limit(promise, "theta");
        Greeks actual = fact.portfolioGreeks();
        check.detail("delta", actual.delta()).detail("theta", actual.theta());
        if (Math.abs(actual.delta()) > deltaMax) {
            check.fail("DELTA_CAP_EXCEEDED", String.format(Locale.ROOT, "|%.4f| > %.4f", actual.delta(), deltaMax));
        }
        if (actual.theta() > thetaMax) {
            check.fail("THETA_CAP_EXCEEDED", String.format(Locale.ROOT, "%.6f > %.6f", actual.theta(), thetaMax));
        }
        return check.build();
    }

    public String proofSummary(Proof proof) {
        StringBuilder summary = new StringBuilder();
        summary.append("Trade ").append(proof.tradeId()).append(": ")
                .append(proof.overall().passed() ? "PASSED" : "FAILED").append('\n');
        proof.checks().forEach((name, check) -> {
            String status = !check.evaluated() ? "SKIPPED" : check.passed() ? "OK" : "FAIL";
            summary.append("  ").append(name).append(": ").append(status).append('\n');
        });
        if (proof.usingFallback()) {
            summary.append("  note: slippage verified from reported value, no NBBO on record\n");
        }
        if (proof.criticalHeadroomAlert()) {
            summary.append("  CRITICAL: repeated greeks headroom breach this session\n");
        }
        for (ProofReason reason : proof.overall().reasons()) {
            summary.append("  - ").append(reason).append('\n');
        }
        return summary.toString();
    }

    private Optional<NbboQuote> lookupNbbo(PostTradeFact fact) {
        try {
            return evidence.nbboAt(fact.symbol(), fact.timestamp(), properties.getNbboTolerance());
        } catch (RuntimeException e) {
            log.warn("NBBO lookup failed for {} at {}: {}", fact.symbol(), fact.timestamp(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Double> persistedPlannedSlippage(String planId) {
        if (isBlank(planId)) {
            return Optional.empty();
        }
        try {
            return evidence.plannedMaxSlippage(planId).filter(value -> value > 0);
        } catch (RuntimeException e) {
            log.warn("Could not load order plan {}: {}", planId, e.getMessage());
            return Optional.empty();
        }
    }

    private double promisedMaxSlippage(PreTradePromise promise) {
        if (promise.executionPlan() != null && positive(promise.executionPlan().maxSlippage())) {
            return promise.executionPlan().maxSlippage();
        }
        return properties.getDefaultMaxSlippage();
    }

    private double limit(PreTradePromise promise, String greek) {
        PreTradePromise.GreeksLimits limits = promise.greeksLimits();
        ProverProperties.Limits defaults = properties.getLimits();
        Double configured = null;
        if (limits != null) {
            configured = switch (greek) {
                case "delta" -> limits.deltaMax();
                case "theta" -> limits.thetaMax();
                default -> limits.vegaMax();
            };
        }
        if (positive(configured)) {
            return configured;
        }
        return switch (greek) {
            case "delta" -> defaults.getDeltaMax();
            case "theta" -> defaults.getThetaMax();
            default -> defaults.getVegaMax();
        };
    }

    private boolean isLeveragedEtf(String symbol) {
        if (symbol == null) {
            return false;
        }
        String normalized = symbol.toUpperCase(Locale.ROOT);
        return properties.getLeveragedEtfSymbols().stream()
                .anyMatch(etf -> normalized.contains(etf.toUpperCase(Locale.ROOT)));
    }

    private static boolean finite(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }

    private static boolean positive(Double value) {
        return finite(value) && value > 0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record GreeksOutcome(ProofCheck check, boolean critical) {}

    record SlippageOutcome(ProofCheck check, boolean usingFallback, Double realSlippage) {}
}
