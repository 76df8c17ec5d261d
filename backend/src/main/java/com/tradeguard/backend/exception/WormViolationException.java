package com.tradeguard.backend.exception;

public class WormViolationException extends RuntimeException {
    public WormViolationException(String message) {
        super(message);
    }
}
