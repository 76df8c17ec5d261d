package com.tradeguard.backend.dto;

import com.tradeguard.backend.trading.coordinator.WinningIntent;
import com.tradeguard.backend.trading.gate.GateDecision;

import java.time.Instant;
import java.util.List;

public record CycleResult(String cycleId, Instant timestamp, List<WinningIntent> intents, List<GateOutcome> outcomes) {

    public record GateOutcome(String intentKey, String symbol, String strategyId, double requestedQty,
                              GateDecision decision) {}

    public List<GateOutcome> accepted() {
        return outcomes.stream().filter(outcome -> outcome.decision().accepted()).toList();
    }
}
