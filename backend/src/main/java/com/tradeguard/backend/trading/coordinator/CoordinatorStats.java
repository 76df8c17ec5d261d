package com.tradeguard.backend.trading.coordinator;

public record CoordinatorStats(long cycles, long signalsScored, long winnersSelected, long conflictsResolved) {}
