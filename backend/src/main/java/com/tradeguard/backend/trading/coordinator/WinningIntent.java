package com.tradeguard.backend.trading.coordinator;

import java.util.List;

/**
 * The selected signal for one symbol. {@code losers} holds every outscored signal;
 * {@code meta.contenders} only the best of them, for the cycle audit.
 */
public record WinningIntent(String key, TradingSignal signal, Meta meta, List<Contender> losers) {

    public record Meta(
            String reason,
            double score,
            List<Contender> contenders,
            double afterCostEv,
            double reliability,
            double liquidity,
            double confidence,
            ScoreBreakdown breakdown
    ) {}

    public record Contender(String strategyId, Side side, double score, String rejectionReason) {}
}
