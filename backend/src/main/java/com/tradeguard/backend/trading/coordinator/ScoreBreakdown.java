package com.tradeguard.backend.trading.coordinator;

public record ScoreBreakdown(
        double profitFactor,
        int tradesCount,
        double winRate,
        double avgWin,
        double avgLoss,
        double costsEst,
        double spreadBps,
        double confidence
) {}
