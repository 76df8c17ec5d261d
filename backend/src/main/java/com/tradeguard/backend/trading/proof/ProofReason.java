package com.tradeguard.backend.trading.proof;

/**
 * Machine-readable code plus the human-readable detail behind it.
 */
public record ProofReason(String code, String message) {

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
