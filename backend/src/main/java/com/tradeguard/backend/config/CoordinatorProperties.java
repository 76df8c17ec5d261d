package com.tradeguard.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "coordinator")
@Data
@Validated
public class CoordinatorProperties {

    /** Contenders listed per conflicting symbol in the cycle audit. */
    @Min(0)
    private int maxContenders = 5;

    /** Trade count beyond which reliability stops growing. */
    @Min(1)
    private int tradesCap = 500;

    private double minReliability = 0.5;
    private double maxReliability = 2.0;
    private double minLiquidity = 0.5;
    private double maxLiquidity = 1.5;
}
