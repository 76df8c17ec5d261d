package com.tradeguard.backend.trading.coordinator;

public record ScoredSignal(
        TradingSignal signal,
        int intakeOrder,
        double reliability,
        double liquidity,
        double afterCostEv,
        double score,
        ScoreBreakdown breakdown,
        String rejectionReason
) {

    public ScoredSignal rejected(String reason) {
        return new ScoredSignal(signal, intakeOrder, reliability, liquidity, afterCostEv, score, breakdown, reason);
    }
}
