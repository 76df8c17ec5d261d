package com.tradeguard.backend.trading.coordinator;

import java.time.Instant;
import java.util.List;

/**
 * What the coordinator saw and chose in its most recent cycle.
 */
public record CycleAudit(
        Instant timestamp,
        int rawSignals,
        int scoredSignals,
        int winners,
        int rejects,
        List<Conflict> conflicts,
        List<WinningIntent> winningIntents
) {

    public record Conflict(String symbol, String winnerStrategyId, double winnerScore,
                           List<WinningIntent.Contender> contenders) {}
}
