package com.tradeguard.backend.trading.coordinator;

/**
 * Trailing performance of a strategy, after costs.
 */
public record StrategyStats(
        double profitFactor,
        int tradesCount,
        double winRate,
        double avgWin,
        double avgLoss
) {

    /** Used for strategies with no recorded history. */
    public static final StrategyStats DEFAULT = new StrategyStats(1.0, 0, 0.5, 0.0, 0.0);

    public StrategyStats {
        if (tradesCount < 0) {
            throw new IllegalArgumentException("tradesCount must not be negative");
        }
        if (!(winRate >= 0.0 && winRate <= 1.0)) {
            throw new IllegalArgumentException("winRate must be within [0, 1]: " + winRate);
        }
        avgWin = Math.abs(avgWin);
        avgLoss = Math.abs(avgLoss);
    }
}
