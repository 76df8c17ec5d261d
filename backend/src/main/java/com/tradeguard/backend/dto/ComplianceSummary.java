package com.tradeguard.backend.dto;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder(toBuilder = true)
public record ComplianceSummary(
        Instant from,
        Instant to,
        long windowHours,
        Metric nbboFreshness,
        Metric quoteLatency,
        Metric friction20,
        Metric friction25,
        double avgFriction,
        Metric proofPassRate,
        Metric slippageConformance,
        int criticalHeadroomAlerts,
        Map<String, RouteBreakdown> routes,
        boolean passed,
        List<String> reasons,
        boolean dataAvailable,
        String summary
) {

    /**
     * A compliant-over-total ratio. {@code threshold} is null for informational metrics.
     */
    public record Metric(int total, int compliant, double ratio, Double threshold, boolean passed) {}

    public record RouteBreakdown(int trades, int passed, double passRate, Double avgRealSlippage, int usingFallback) {}
}
