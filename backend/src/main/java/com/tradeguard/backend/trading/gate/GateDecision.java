package com.tradeguard.backend.trading.gate;

public record GateDecision(Decision decision, GateRejectReason reason, String message, double routedQty) {

    public enum Decision {
        ACCEPT,
        REJECT
    }

    public static GateDecision accept(double routedQty, String message) {
        return new GateDecision(Decision.ACCEPT, null, message, routedQty);
    }

    public static GateDecision reject(GateRejectReason reason, String message) {
        return new GateDecision(Decision.REJECT, reason, message, 0.0);
    }

    public boolean accepted() {
        return decision == Decision.ACCEPT;
    }
}
