package com.tradeguard.backend.trading.gate;

import lombok.Builder;

/**
 * Inputs to one admission decision. Values are boxed because upstream feeds may
 * not supply them; a missing value fails its check instead of defaulting.
 */
@Builder(toBuilder = true)
public record GateContext(
        String symbol,
        String strategyId,
        Double nav,
        Double portfolioHeat,
        Double strategyHeat,
        Double ddMult,
        Double requestedQty,
        Double price,
        Double availableCash,
        Double quoteAgeS,
        Double brokerAgeS,
        Boolean stale
) {}
