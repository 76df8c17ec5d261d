package com.tradeguard.backend.trading.proof;

import java.time.Instant;

public record NbboQuote(String symbol, double bid, double ask, double mid, Instant receivedAt) {}
