package com.tradeguard.backend.dto;

public record PoolStatus(
        double poolCap,
        double activeTotal,
        double stagedTotal,
        double availableCapacity,
        double utilization,
        int activeCount,
        int stagedCount,
        String riskLevel,
        ProductionMetrics metrics,
        boolean dataAvailable
) {}
