package com.tradeguard.backend.service.marketdata;

import java.time.Instant;

/**
 * Market-data and broker freshness as seen by the gate. Ages are null when unknown.
 */
public record HealthSnapshot(Double quoteAgeS, Double brokerAgeS, int errorBudget, boolean stale, Instant checkedAt) {}
