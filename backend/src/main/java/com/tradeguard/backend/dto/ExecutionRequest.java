package com.tradeguard.backend.dto;

import com.tradeguard.backend.trading.proof.Greeks;
import com.tradeguard.backend.trading.proof.PreTradePromise;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An order to run through the gate, send and prove. The portfolio state feeds the
 * gate; a missing portfolio makes an entry order fail closed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRequest {

    @NotBlank
    private String planId;

    @NotBlank
    private String symbol;

    @NotBlank
    private String side;

    private String optionType;

    @NotNull
    @Positive
    private Integer quantity;

    @NotNull
    @Positive
    private Double limitPrice;

    @NotNull
    @Positive
    private Double plannedMaxSlip;

    private String strategyId;
    private PortfolioState portfolio;
    private String route;
    private List<Double> ladders;
    private String allocationId;
    private PreTradePromise promise;
    private Greeks portfolioGreeks;
    private List<String> sides;
    private Boolean entry;
}
