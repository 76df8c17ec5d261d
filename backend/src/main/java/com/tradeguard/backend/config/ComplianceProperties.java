package com.tradeguard.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "compliance")
@Data
@Validated
public class ComplianceProperties {

    @NotNull
    private Duration window = Duration.ofHours(24);

    @PositiveOrZero
    @DecimalMax("1.0")
    private double minNbboFreshness = 0.95;

    @PositiveOrZero
    @DecimalMax("1.0")
    private double minFriction20 = 0.90;

    @PositiveOrZero
    @DecimalMax("1.0")
    private double minFriction25 = 1.0;

    @PositiveOrZero
    @DecimalMax("1.0")
    private double minSlippageConformance = 0.95;

    @PositiveOrZero
    @DecimalMax("1.0")
    private double minProofPassRate = 0.95;

    /** Fee-to-notional ratios counted as compliant friction. */
    private double friction20Threshold = 0.20;
    private double friction25Threshold = 0.25;
}
