package com.tradeguard.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "allocator")
@Data
@Validated
public class AllocatorProperties {

    @NotBlank
    private String defaultPool = "EVO";

    @Min(1)
    private int defaultTtlDays = 7;

    /** Staging requires a quote received within this age. */
    @NotNull
    private Duration nbboMaxAge = Duration.ofSeconds(300);

    /** An in-progress rebalance older than this may be taken over. */
    @NotNull
    private Duration rebalanceLockTimeout = Duration.ofMinutes(10);

    private boolean requireCompliancePass = true;

    @Positive
    private double fallbackEquity = 100_000;

    @Min(2)
    private int performanceLookbackDays = 20;

    private boolean rebalanceScheduleEnabled = false;

    @Valid
    private Precheck precheck = new Precheck();

    @Valid
    private PoolCap poolCap = new PoolCap();

    @Data
    public static class Precheck {
        private double minSharpe = 1.2;
        private double maxDrawdown = 0.12;
        private double minWinRate = 0.52;
        @Min(0)
        private int minTrades = 25;
        private double maxAvgSlippageBps = 10;
        private double minTraceCompleteness = 0.98;
    }

    @Data
    public static class PoolCap {
        @Positive
        private double base = 0.05;
        private double bonus = 0.02;
        private double bonusSharpe = 1.2;
        private double penaltyCap = 0.02;
        @Positive
        private double minCap = 0.03;
        @Positive
        private double maxCap = 0.10;
    }
}
