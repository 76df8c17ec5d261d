package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.dto.ProductionMetrics;
import com.tradeguard.backend.model.LedgerSnapshot;
import com.tradeguard.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Trailing production Sharpe and drawdown, derived from recorded ledger changes.
 * Daily equity is the last cash balance of each UTC day.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProductionPerformanceService {

    static final double TRADING_DAYS_PER_YEAR = 252.0;

    private final MarketRecorderService marketRecorderService;
    private final AllocatorProperties properties;
    private final Clock clock;

    public ProductionMetrics currentMetrics() {
        Instant now = clock.instant();
        try {
            Instant from = now.minus(Duration.ofDays(properties.getPerformanceLookbackDays()));
            List<LedgerSnapshot> changes = marketRecorderService.ledgerChanges(from, now);
            List<Double> equity = dailyEquity(changes);
            double latest = equity.isEmpty() ? currentEquity() : equity.get(equity.size() - 1);
            if (equity.size() < 2) {
                return ProductionMetrics.unavailable(latest, equity.size());
            }
            return new ProductionMetrics(
                    MoneyUtils.round(sharpe(equity), 4),
                    MoneyUtils.round(maxDrawdown(equity), 4),
                    equity.size(),
                    latest,
                    true);
        } catch (RuntimeException e) {
            log.warn("Production metrics unavailable: {}", e.getMessage());
            return ProductionMetrics.unavailable(properties.getFallbackEquity(), 0);
        }
    }

    /** Latest recorded cash balance, or the configured fallback when none can be read. */
    public double currentEquity() {
        try {
            return marketRecorderService.latestLedger()
                    .map(LedgerSnapshot::getCashAfter)
                    .map(MoneyUtils::toDouble)
                    .orElse(properties.getFallbackEquity());
        } catch (RuntimeException e) {
            log.warn("Latest ledger unavailable, using fallback equity: {}", e.getMessage());
            return properties.getFallbackEquity();
        }
    }

    static List<Double> dailyEquity(List<LedgerSnapshot> changes) {
        Map<LocalDate, Double> byDay = new TreeMap<>();
        for (LedgerSnapshot change : changes) {
            LocalDate day = change.getTsChange().atZone(ZoneOffset.UTC).toLocalDate();
            byDay.put(day, MoneyUtils.toDouble(change.getCashAfter()));
        }
        return new ArrayList<>(byDay.values());
    }

    static double sharpe(List<Double> equity) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equity.size(); i++) {
            double previous = equity.get(i - 1);
            if (previous > 0) {
                returns.add((equity.get(i) - previous) / previous);
            }
        }
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream().mapToDouble(r -> (r - mean) * (r - mean)).sum() / (returns.size() - 1);
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0.0) {
            return 0.0;
        }
        return mean / stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    static double maxDrawdown(List<Double> equity) {
        double peak = 0.0;
        double maxDrawdown = 0.0;
        for (double value : equity) {
            if (value > peak) {
                peak = value;
            }
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak);
            }
        }
        return maxDrawdown;
    }
}
