package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.dto.ProductionMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PoolCapCalculatorTest {

    private final AllocatorProperties properties = new AllocatorProperties();
    private final PoolCapCalculator calculator = new PoolCapCalculator(properties);

    @Test
    void strongSharpeEarnsTheBonus() {
        assertThat(calculator.compute(metrics(1.5, 0.0))).isEqualTo(0.07);
        assertThat(calculator.compute(metrics(1.2, 0.0))).isEqualTo(0.07);
    }

    @Test
    void drawdownNarrowsThePool() {
        assertThat(calculator.compute(metrics(0.5, 0.005))).isEqualTo(0.04);
        assertThat(calculator.compute(metrics(1.5, 0.005))).isEqualTo(0.06);
    }

    @Test
    void penaltyIsCappedAndResultClampedToTheFloor() {
        assertThat(calculator.compute(metrics(0.0, 0.40))).isEqualTo(0.03);
    }

    @Test
    void missingHistoryUsesTheBase() {
        assertThat(calculator.compute(ProductionMetrics.unavailable(100_000, 1))).isEqualTo(0.05);
    }

    @Test
    void ceilingApplies() {
        properties.getPoolCap().setBase(0.2);

        assertThat(calculator.compute(metrics(2.0, 0.0))).isEqualTo(0.10);
    }

    private static ProductionMetrics metrics(double sharpe, double drawdown) {
        return new ProductionMetrics(sharpe, drawdown, 20, 100_000, true);
    }
}
