package com.tradeguard.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Risk state supplied by the portfolio engine for one cycle. Missing values make
 * the gate reject.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioState {

    private Double nav;
    private Double portfolioHeat;
    private Double availableCash;
    private Double ddMult;
    private Map<String, Double> strategyHeat;
}
