package com.tradeguard.backend.dto;

import com.tradeguard.backend.trading.coordinator.Side;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signal as delivered by a strategy. Optional fields take the signal defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalInput {

    @NotBlank
    private String symbol;

    @NotNull
    private Side side;

    @NotBlank
    private String strategyId;

    private Double confidence;
    private Double price;
    private Double spreadBps;
    private Double costsEst;
    private Double quantity;
}
