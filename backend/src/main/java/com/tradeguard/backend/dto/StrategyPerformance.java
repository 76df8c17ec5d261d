package com.tradeguard.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Backtest or paper-trading record a strategy is promoted on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyPerformance {

    @NotNull
    private Double sharpe;

    /** Fraction, e.g. 0.08 for an 8% drawdown. */
    @NotNull
    @PositiveOrZero
    private Double maxDrawdown;

    @NotNull
    @PositiveOrZero
    private Double winRate;

    @NotNull
    @PositiveOrZero
    private Integer trades;

    @NotNull
    @PositiveOrZero
    private Double avgSlippageBps;

    @NotNull
    @PositiveOrZero
    private Double traceCompleteness;
}
