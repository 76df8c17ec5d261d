package com.tradeguard.backend.trading.coordinator;

public enum Side {
    BUY,
    SELL
}
