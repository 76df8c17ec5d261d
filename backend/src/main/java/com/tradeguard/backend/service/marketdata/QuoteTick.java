package com.tradeguard.backend.service.marketdata;

import java.time.Instant;

public record QuoteTick(String symbol, double bid, double ask, Instant tsFeed, Instant tsRecv, String source) {

    public double mid() {
        return (bid + ask) / 2.0;
    }
}
