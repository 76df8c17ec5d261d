package com.tradeguard.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "prover")
@Data
@Validated
public class ProverProperties {

    @Positive
    private double slippageMultiplier = 1.5;

    @Positive
    @DecimalMax("1.0")
    private double minFillPct = 0.8;

    @PositiveOrZero
    private double netDebitTolerance = 0.01;

    @PositiveOrZero
    private double costTolerancePct = 0.05;

    /** Actual headroom must stay above reserved headroom times this factor. */
    @Positive
    @DecimalMax("1.0")
    private double headroomBuffer = 0.95;

    @Positive
    private double greeksDriftMax = 0.02;

    @Positive
    private double defaultMaxSlippage = 0.06;

    @NotNull
    private Duration nbboTolerance = Duration.ofSeconds(1);

    /** When set, a fill with no recorded NBBO fails instead of falling back to reported slippage. */
    private boolean requireNbbo = false;

    @PositiveOrZero
    private double leveragedEtfBonus = 0.0001;

    private List<String> leveragedEtfSymbols = new ArrayList<>(List.of("SOXL", "SOXS", "TQQQ", "SQQQ"));

    private Limits limits = new Limits();
    private Headroom headroom = new Headroom();

    @Data
    public static class Limits {
        @Positive
        private double deltaMax = 0.10;

        @Positive
        private double thetaMax = 0.0025;

        @Positive
        private double vegaMax = 0.20;
    }

    @Data
    public static class Headroom {
        /** Buffer breaches within one session that raise the critical alert. */
        @Min(1)
        private int alertThreshold = 2;

        @NotNull
        private ResetPolicy resetPolicy = ResetPolicy.PROCESS;

        /** Zone whose calendar day delimits a trading-day session. */
        @NotBlank
        private String tradingZone = "America/New_York";
    }

    public enum ResetPolicy {
        PROCESS,
        TRADING_DAY
    }
}
