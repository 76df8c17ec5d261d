package com.tradeguard.backend.trading.coordinator;

import java.util.Objects;

/**
 * One strategy's proposal for one symbol in one coordination cycle.
 * Constructed through {@link #of} so that defaults live in one place.
 */
public record TradingSignal(
        String symbol,
        Side side,
        String strategyId,
        double confidence,
        double price,
        double spreadBps,
        double costsEst,
        double quantity
) {

    public static final double DEFAULT_CONFIDENCE = 1.0;
    public static final double DEFAULT_SPREAD_BPS = 0.0;
    public static final double DEFAULT_COSTS = 0.0;
    public static final double DEFAULT_QUANTITY = 1.0;

    public TradingSignal {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Signal symbol is required");
        }
        Objects.requireNonNull(side, "Signal side is required");
        if (strategyId == null || strategyId.isBlank()) {
            throw new IllegalArgumentException("Signal strategyId is required");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Signal confidence must be within [0, 1]: " + confidence);
        }
        requireFinite("price", price);
        requireFinite("spreadBps", spreadBps);
        requireFinite("costsEst", costsEst);
        requireFinite("quantity", quantity);
        if (spreadBps < 0) {
            throw new IllegalArgumentException("Signal spreadBps must not be negative: " + spreadBps);
        }
        symbol = symbol.trim().toUpperCase();
    }

    public static TradingSignal of(String symbol, Side side, String strategyId, Double confidence, Double price,
                                   Double spreadBps, Double costsEst, Double quantity) {
        return new TradingSignal(
                symbol,
                side,
                strategyId,
                confidence == null ? DEFAULT_CONFIDENCE : confidence,
                price == null ? 0.0 : price,
                spreadBps == null ? DEFAULT_SPREAD_BPS : spreadBps,
                costsEst == null ? DEFAULT_COSTS : costsEst,
                quantity == null ? DEFAULT_QUANTITY : quantity
        );
    }

    public String intentKey() {
        return symbol + ":" + side + ":" + strategyId;
    }

    private static void requireFinite(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Signal " + field + " must be finite");
        }
    }
}
