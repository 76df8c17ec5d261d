package com.tradeguard.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleRequest {

    @NotNull
    private List<@Valid SignalInput> signals;

    private Map<String, StrategyStatsInput> stats;

    @Valid
    private PortfolioState portfolio;
}
