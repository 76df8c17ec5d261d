package com.tradeguard.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "gate")
@Data
@Validated
public class GateProperties {

    @Positive
    private double quoteStaleSec = 10;

    @Positive
    private double brokerStaleSec = 30;

    @Positive
    @DecimalMax("1.0")
    private double maxPortfolioHeat = 0.25;

    @Positive
    @DecimalMax("1.0")
    private double maxStrategyHeat = 0.10;
}
