package com.tradeguard.backend.service.marketdata;

import java.math.BigDecimal;
import java.time.Instant;

public record FillEvent(String planId, String symbol, String side, BigDecimal price, int quantity, BigDecimal fees,
                        Instant tsFill, String brokerAttestation, String allocationId) {}
