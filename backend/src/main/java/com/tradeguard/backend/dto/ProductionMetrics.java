package com.tradeguard.backend.dto;

/**
 * Trailing production performance driving the pool cap. {@code available} is false
 * when history was too short or could not be read; the ratios are then zero.
 */
public record ProductionMetrics(double sharpe20d, double maxDrawdown20d, int days, double equity, boolean available) {

    public static ProductionMetrics unavailable(double equity, int days) {
        return new ProductionMetrics(0.0, 0.0, days, equity, false);
    }
}
