package com.tradeguard.backend.service.marketdata;

import java.time.Instant;
import java.util.List;

/**
 * An order as planned before submission, including its limit-price ladder.
 */
public record OrderPlan(String planId, String symbol, String route, List<Double> ladders, double plannedMaxSlip,
                        Instant createdAt) {}
