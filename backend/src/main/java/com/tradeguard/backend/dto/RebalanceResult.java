package com.tradeguard.backend.dto;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder(toBuilder = true)
public record RebalanceResult(
        String bucket,
        RebalanceMode mode,
        double poolCap,
        double beforeTotal,
        double afterTotal,
        List<AllocationChange> activated,
        List<AllocationChange> rejected,
        List<AllocationChange> expired,
        ProductionMetrics metrics,
        Instant computedAt,
        boolean replayed
) {

    public enum RebalanceMode {
        PREVIEW,
        EXECUTE
    }
}
