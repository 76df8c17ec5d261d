package com.tradeguard.backend.service.broker;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Execution boundary. {@link #submit} either returns a confirmed fill or throws;
 * there is no partial acknowledgement.
 */
public interface BrokerPort {

    BrokerExecution submit(BrokerOrderRequest request);

    /** Last time the broker was known reachable, or null when never. */
    Instant lastHeartbeat();

    record BrokerOrderRequest(String planId, String symbol, String side, int quantity, Double limitPrice) {}

    record BrokerExecution(
            String brokerOrderId,
            String planId,
            String symbol,
            String side,
            BigDecimal price,
            int filledQty,
            BigDecimal fees,
            Instant filledAt,
            String attestation
    ) {}
}
