package com.tradeguard.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageRequest {

    @NotBlank
    private String sessionId;

    @NotBlank
    private String strategyRef;

    @NotNull
    @Positive
    @DecimalMax("1.0")
    private Double allocation;

    private String pool;

    @Positive
    private Integer ttlDays;

    @NotBlank
    private String consistencyToken;

    @Valid
    @NotNull
    private StrategyPerformance performance;
}
