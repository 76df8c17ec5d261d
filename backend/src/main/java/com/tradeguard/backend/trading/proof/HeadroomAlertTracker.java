package com.tradeguard.backend.trading.proof;

import com.tradeguard.backend.config.ProverProperties;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Counts greeks headroom buffer breaches within a session.
 * <p>
 * With {@link ProverProperties.ResetPolicy#PROCESS} the session is the lifetime of
 * the owning prover; with {@link ProverProperties.ResetPolicy#TRADING_DAY} the count
 * restarts on the first breach of a new trading day in the configured zone.
 */
public class HeadroomAlertTracker {

    private final ProverProperties.ResetPolicy resetPolicy;
    private final int alertThreshold;
    private final ZoneId tradingZone;
    private final Instant sessionStart;
    private int breaches;
    private LocalDate sessionDay;

    public HeadroomAlertTracker(ProverProperties.ResetPolicy resetPolicy, int alertThreshold, ZoneId tradingZone,
                                Instant sessionStart) {
        this.resetPolicy = resetPolicy;
        this.alertThreshold = alertThreshold;
        this.tradingZone = tradingZone;
        this.sessionStart = sessionStart;
        this.sessionDay = sessionStart.atZone(tradingZone).toLocalDate();
    }

    public static HeadroomAlertTracker from(ProverProperties properties, Instant sessionStart) {
        ProverProperties.Headroom headroom = properties.getHeadroom();
        return new HeadroomAlertTracker(headroom.getResetPolicy(), headroom.getAlertThreshold(),
                ZoneId.of(headroom.getTradingZone()), sessionStart);
    }

    public synchronized Result record(Instant at) {
        LocalDate day = at.atZone(tradingZone).toLocalDate();
        if (resetPolicy == ProverProperties.ResetPolicy.TRADING_DAY && !day.equals(sessionDay)) {
            breaches = 0;
            sessionDay = day;
        }
        breaches++;
        return new Result(breaches, breaches >= alertThreshold);
    }

    public synchronized int breachCount() {
        return breaches;
    }

    public Instant sessionStart() {
        return sessionStart;
    }

    public record Result(int sessionCount, boolean critical) {}
}
