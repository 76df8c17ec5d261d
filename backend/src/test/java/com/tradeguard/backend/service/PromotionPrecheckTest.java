package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.dto.PrecheckResult;
import com.tradeguard.backend.dto.StrategyPerformance;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PromotionPrecheckTest {

    private final PromotionPrecheck precheck = new PromotionPrecheck(new AllocatorProperties());

    @Test
    void qualifyingStrategyPasses() {
        PrecheckResult result = precheck.evaluate(qualifying().build());

        assertThat(result.passed()).isTrue();
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void everyFailingThresholdIsItemized() {
        PrecheckResult result = precheck.evaluate(StrategyPerformance.builder()
                .sharpe(1.1)
                .maxDrawdown(0.15)
                .winRate(0.50)
                .trades(10)
                .avgSlippageBps(12.0)
                .traceCompleteness(0.90)
                .build());

        assertThat(result.passed()).isFalse();
        assertThat(result.failures()).containsExactly(
                "Sharpe 1.10 < 1.20",
                "Max drawdown 15.0% > 12.0%",
                "Win rate 50.0% < 52.0%",
                "Trades 10 < 25",
                "Avg slippage 12.0bps > 10.0bps",
                "Trace completeness 90.0% < 98.0%");
    }

    @Test
    void boundaryValuesPass() {
        PrecheckResult result = precheck.evaluate(qualifying()
                .sharpe(1.2)
                .maxDrawdown(0.12)
                .winRate(0.52)
                .trades(25)
                .avgSlippageBps(10.0)
                .traceCompleteness(0.98)
                .build());

        assertThat(result.passed()).isTrue();
    }

    @Test
    void missingMetricsFail() {
        assertThat(precheck.evaluate(null).failures()).containsExactly("performance metrics missing");
        assertThat(precheck.evaluate(qualifying().sharpe(null).build()).failures()).containsExactly("sharpe missing");
    }

    private static StrategyPerformance.StrategyPerformanceBuilder qualifying() {
        return StrategyPerformance.builder()
                .sharpe(1.6)
                .maxDrawdown(0.08)
                .winRate(0.58)
                .trades(120)
                .avgSlippageBps(4.0)
                .traceCompleteness(0.995);
    }
}
