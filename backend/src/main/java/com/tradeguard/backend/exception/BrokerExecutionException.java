package com.tradeguard.backend.exception;

/**
 * Raised when the broker cannot confirm an order. The trade has no safe
 * continuation, so this is never swallowed by the pipeline.
 */
public class BrokerExecutionException extends RuntimeException {
    public BrokerExecutionException(String message) {
        super(message);
    }

    public BrokerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
