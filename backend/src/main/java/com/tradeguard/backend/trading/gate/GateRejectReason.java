package com.tradeguard.backend.trading.gate;

public enum GateRejectReason {
    STALE_DATA,
    PORTFOLIO_HEAT,
    STRATEGY_HEAT,
    INSUFFICIENT_CASH,
    SIZE_ZERO
}
