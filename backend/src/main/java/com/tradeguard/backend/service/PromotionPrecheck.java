package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.dto.PrecheckResult;
import com.tradeguard.backend.dto.StrategyPerformance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Hard promotion thresholds. Every threshold is checked so the caller sees all
 * failures at once; a missing metric is a failure.
 */
@Component
public class PromotionPrecheck {

    private final AllocatorProperties properties;

    public PromotionPrecheck(AllocatorProperties properties) {
        this.properties = properties;
    }

    public PrecheckResult evaluate(StrategyPerformance performance) {
        if (performance == null) {
            return new PrecheckResult(false, List.of("performance metrics missing"));
        }
        AllocatorProperties.Precheck limits = properties.getPrecheck();
        List<String> failures = new ArrayList<>();

        if (performance.getSharpe() == null) {
            failures.add("sharpe missing");
        } else if (performance.getSharpe() < limits.getMinSharpe()) {
            failures.add(format("Sharpe %.2f < %.2f", performance.getSharpe(), limits.getMinSharpe()));
        }
        if (performance.getMaxDrawdown() == null) {
            failures.add("maxDrawdown missing");
        } else if (performance.getMaxDrawdown() > limits.getMaxDrawdown()) {
            failures.add(format("Max drawdown %.1f%% > %.1f%%", performance.getMaxDrawdown() * 100,
                    limits.getMaxDrawdown() * 100));
        }
        if (performance.getWinRate() == null) {
            failures.add("winRate missing");
        } else if (performance.getWinRate() < limits.getMinWinRate()) {
            failures.add(format("Win rate %.1f%% < %.1f%%", performance.getWinRate() * 100,
                    limits.getMinWinRate() * 100));
        }
        if (performance.getTrades() == null) {
            failures.add("trades missing");
        } else if (performance.getTrades() < limits.getMinTrades()) {
            failures.add("Trades " + performance.getTrades() + " < " + limits.getMinTrades());
        }
        if (performance.getAvgSlippageBps() == null) {
            failures.add("avgSlippageBps missing");
        } else if (performance.getAvgSlippageBps() > limits.getMaxAvgSlippageBps()) {
            failures.add(format("Avg slippage %.1fbps > %.1fbps", performance.getAvgSlippageBps(),
                    limits.getMaxAvgSlippageBps()));
        }
        if (performance.getTraceCompleteness() == null) {
            failures.add("traceCompleteness missing");
        } else if (performance.getTraceCompleteness() < limits.getMinTraceCompleteness()) {
            failures.add(format("Trace completeness %.1f%% < %.1f%%", performance.getTraceCompleteness() * 100,
                    limits.getMinTraceCompleteness() * 100));
        }
        return new PrecheckResult(failures.isEmpty(), List.copyOf(failures));
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
