package com.tradeguard.backend.service.marketdata;

import java.math.BigDecimal;
import java.time.Instant;

public record LedgerChange(BigDecimal cashBefore, BigDecimal cashAfter, String reason, String planId, Instant at) {}
