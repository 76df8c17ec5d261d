package com.tradeguard.backend.trading.gate;

import com.tradeguard.backend.config.GateProperties;
import org.springframework.stereotype.Component;

/**
 * Stateless admission control. Checks run in a fixed order and the first
 * failing check decides the rejection reason.
 */
@Component
public class PreTradeGate {

    private final GateProperties properties;

    public PreTradeGate(GateProperties properties) {
        this.properties = properties;
    }

    public GateDecision evaluate(GateContext ctx) {
        if (ctx == null) {
            return GateDecision.reject(GateRejectReason.STALE_DATA, "No gate context supplied");
        }

        String staleness = stalenessProblem(ctx);
        if (staleness != null) {
            return GateDecision.reject(GateRejectReason.STALE_DATA, staleness);
        }

        if (missing(ctx.portfolioHeat())) {
            return GateDecision.reject(GateRejectReason.PORTFOLIO_HEAT, "Portfolio heat unavailable");
        }
        if (ctx.portfolioHeat() >= properties.getMaxPortfolioHeat()) {
            return GateDecision.reject(GateRejectReason.PORTFOLIO_HEAT, String.format(
                    "Portfolio heat %.4f at or above cap %.4f", ctx.portfolioHeat(), properties.getMaxPortfolioHeat()));
        }

        if (missing(ctx.strategyHeat())) {
            return GateDecision.reject(GateRejectReason.STRATEGY_HEAT, "Strategy heat unavailable");
        }
        if (ctx.strategyHeat() >= properties.getMaxStrategyHeat()) {
            return GateDecision.reject(GateRejectReason.STRATEGY_HEAT, String.format(
                    "Strategy heat %.4f at or above cap %.4f", ctx.strategyHeat(), properties.getMaxStrategyHeat()));
        }

        if (missing(ctx.price()) || missing(ctx.availableCash())) {
            return GateDecision.reject(GateRejectReason.INSUFFICIENT_CASH, "Price or available cash unavailable");
        }
        double requested = missing(ctx.requestedQty()) ? 0.0 : ctx.requestedQty();
        double notional = Math.abs(requested * ctx.price());
        if (notional > ctx.availableCash()) {
            return GateDecision.reject(GateRejectReason.INSUFFICIENT_CASH, String.format(
                    "Notional %.2f exceeds available cash %.2f", notional, ctx.availableCash()));
        }

        double routed = routedQuantity(requested, ctx.ddMult());
        if (routed <= 0) {
            return GateDecision.reject(GateRejectReason.SIZE_ZERO, String.format(
                    "Routed quantity is zero (requested %s, drawdown multiplier %s)", ctx.requestedQty(), ctx.ddMult()));
        }
        return GateDecision.accept(routed, String.format("Accepted %s of %s requested", routed, requested));
    }

    /**
     * Admission for an order that reduces an existing position. Heat, cash and the
     * drawdown multiplier do not apply, but stale data still refuses the order.
     */
    public GateDecision evaluateExit(GateContext ctx) {
        if (ctx == null) {
            return GateDecision.reject(GateRejectReason.STALE_DATA, "No gate context supplied");
        }
        String staleness = stalenessProblem(ctx);
        if (staleness != null) {
            return GateDecision.reject(GateRejectReason.STALE_DATA, staleness);
        }
        if (missing(ctx.requestedQty()) || ctx.requestedQty() <= 0) {
            return GateDecision.reject(GateRejectReason.SIZE_ZERO, "Exit quantity must be positive");
        }
        return GateDecision.accept(ctx.requestedQty(), String.format("Exit of %s accepted", ctx.requestedQty()));
    }

    private String stalenessProblem(GateContext ctx) {
        if (ctx.stale() == null) {
            return "Health snapshot missing stale flag";
        }
        if (ctx.stale()) {
            return "Market data flagged stale";
        }
        if (missing(ctx.quoteAgeS()) || ctx.quoteAgeS() < 0) {
            return "Quote age unavailable";
        }
        if (missing(ctx.brokerAgeS()) || ctx.brokerAgeS() < 0) {
            return "Broker age unavailable";
        }
        if (ctx.quoteAgeS() > properties.getQuoteStaleSec()) {
            return String.format("Quote age %.1fs exceeds %.1fs", ctx.quoteAgeS(), properties.getQuoteStaleSec());
        }
        if (ctx.brokerAgeS() > properties.getBrokerStaleSec()) {
            return String.format("Broker age %.1fs exceeds %.1fs", ctx.brokerAgeS(), properties.getBrokerStaleSec());
        }
        return null;
    }

    private static double routedQuantity(double requested, Double ddMult) {
        if (requested <= 0 || missing(ddMult)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(requested, requested * ddMult));
    }

    private static boolean missing(Double value) {
        return value == null || value.isNaN() || value.isInfinite();
    }
}
