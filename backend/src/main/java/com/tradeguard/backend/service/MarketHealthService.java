package com.tradeguard.backend.service;

import com.tradeguard.backend.config.GateProperties;
import com.tradeguard.backend.config.MarketDataProperties;
import com.tradeguard.backend.service.broker.BrokerPort;
import com.tradeguard.backend.service.marketdata.HealthSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Staleness watcher. Every probe that finds quotes or the broker older than the
 * gate limits spends one unit of the error budget; a healthy probe refills it.
 * Once the budget is spent the feed is reported stale until a healthy probe.
 */
@Slf4j
@Service
public class MarketHealthService {

    private final MarketRecorderService marketRecorderService;
    private final BrokerPort brokerPort;
    private final GateProperties gateProperties;
    private final MarketDataProperties properties;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final Clock clock;
    private final AtomicInteger remainingBudget;

    public MarketHealthService(MarketRecorderService marketRecorderService, BrokerPort brokerPort,
                               GateProperties gateProperties, MarketDataProperties properties,
                               ScheduledTaskGuard scheduledTaskGuard, Clock clock) {
        this.marketRecorderService = marketRecorderService;
        this.brokerPort = brokerPort;
        this.gateProperties = gateProperties;
        this.properties = properties;
        this.scheduledTaskGuard = scheduledTaskGuard;
        this.clock = clock;
        this.remainingBudget = new AtomicInteger(properties.getErrorBudget());
    }

    @Scheduled(fixedDelayString = "${market-data.health-check-interval-ms:5000}")
    public void scheduledProbe() {
        scheduledTaskGuard.run("market-health", this::probe);
    }

    public HealthSnapshot probe() {
        HealthSnapshot current = snapshot();
        boolean healthy = current.quoteAgeS() != null && current.brokerAgeS() != null
                && current.quoteAgeS() <= gateProperties.getQuoteStaleSec()
                && current.brokerAgeS() <= gateProperties.getBrokerStaleSec();
        if (healthy) {
            remainingBudget.set(properties.getErrorBudget());
        } else {
            int left = remainingBudget.updateAndGet(value -> Math.max(0, value - 1));
            log.warn("Market health probe failed quoteAgeS={} brokerAgeS={} budgetLeft={}", current.quoteAgeS(),
                    current.brokerAgeS(), left);
        }
        return snapshot();
    }

    public HealthSnapshot snapshot() {
        Instant now = clock.instant();
        Double quoteAge = ageSeconds(readQuoteTime(), now);
        Double brokerAge = ageSeconds(readBrokerHeartbeat(), now);
        int budget = remainingBudget.get();
        boolean stale = budget <= 0 || quoteAge == null || brokerAge == null;
        return new HealthSnapshot(quoteAge, brokerAge, budget, stale, now);
    }

    private Instant readQuoteTime() {
        try {
            return marketRecorderService.latestQuoteReceivedAt().orElse(null);
        } catch (RuntimeException e) {
            log.warn("Quote freshness unavailable: {}", e.getMessage());
            return null;
        }
    }

    private Instant readBrokerHeartbeat() {
        try {
            return brokerPort.lastHeartbeat();
        } catch (RuntimeException e) {
            log.warn("Broker heartbeat unavailable: {}", e.getMessage());
            return null;
        }
    }

    private static Double ageSeconds(Instant at, Instant now) {
        if (at == null) {
            return null;
        }
        return Duration.between(at, now).toMillis() / 1000.0;
    }
}
