package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.dto.ProductionMetrics;
import com.tradeguard.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

/**
 * Risk thermostat: widens the pool on strong trailing Sharpe, narrows it on drawdown.
 */
@Component
public class PoolCapCalculator {

    private final AllocatorProperties properties;

    public PoolCapCalculator(AllocatorProperties properties) {
        this.properties = properties;
    }

    public double compute(ProductionMetrics metrics) {
        AllocatorProperties.PoolCap cap = properties.getPoolCap();
        double bonus = metrics.sharpe20d() >= cap.getBonusSharpe() ? cap.getBonus() : 0.0;
        double penalty = Math.min(Math.max(0.0, metrics.maxDrawdown20d()) * 2, cap.getPenaltyCap());
        double raw = cap.getBase() + bonus - penalty;
        double clamped = Math.max(cap.getMinCap(), Math.min(cap.getMaxCap(), raw));
        return MoneyUtils.round(clamped, 4);
    }
}
