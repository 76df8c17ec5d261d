package com.tradeguard.backend.trading.proof;

import lombok.Builder;

/**
 * What the pre-trade plan committed to: structure, size, greeks budget and slippage.
 */
@Builder
public record PreTradePromise(
        String optionType,
        Sizing sizing,
        GreeksLimits greeksLimits,
        ExecutionPlan executionPlan,
        Structure structure
) {

    /** Notional cost and greeks reserved for this trade. */
    public record Sizing(Double notional, Greeks greeks) {}

    public record GreeksLimits(Double deltaMax, Double thetaMax, Double vegaMax) {}

    public record ExecutionPlan(Double maxSlippage) {}

    public record Structure(Double netDebit) {}
}
