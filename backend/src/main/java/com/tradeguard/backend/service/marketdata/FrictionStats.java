package com.tradeguard.backend.service.marketdata;

/**
 * Fee-to-notional friction of fills in a window. Ratios are 1.0 for an empty window.
 */
public record FrictionStats(
        int totalFills,
        double avgFriction,
        int within20Count,
        int within25Count
) {

    public static final FrictionStats EMPTY = new FrictionStats(0, 0.0, 0, 0);

    public double within20Ratio() {
        return totalFills == 0 ? 1.0 : within20Count / (double) totalFills;
    }

    public double within25Ratio() {
        return totalFills == 0 ? 1.0 : within25Count / (double) totalFills;
    }
}
