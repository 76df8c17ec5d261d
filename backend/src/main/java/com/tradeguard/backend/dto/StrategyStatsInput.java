package com.tradeguard.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyStatsInput {

    private double profitFactor;
    private int tradesCount;
    private double winRate;
    private double avgWin;
    private double avgLoss;
}
