package com.tradeguard.backend.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record LedgerView(
        List<Entry> allocations,
        double totalAllocation,
        BigDecimal equity,
        BigDecimal totalRealizedPnl,
        BigDecimal totalUnrealizedPnl,
        boolean pnlAvailable,
        Instant generatedAt
) {

    public record Entry(
            String id,
            String sessionId,
            String strategyRef,
            String pool,
            double allocation,
            String status,
            Instant ttlUntil,
            BigDecimal allocatedCapital,
            int openQuantity,
            BigDecimal realizedPnl,
            BigDecimal unrealizedPnl
    ) {}
}
