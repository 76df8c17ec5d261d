package com.tradeguard.backend.exception;

import lombok.Getter;

/**
 * A safety precondition could not be verified, so the operation is refused.
 */
@Getter
public class FailClosedException extends RuntimeException {

    private final String code;
    private final String reason;

    public FailClosedException(String code, String reason, String message) {
        super(message);
        this.code = code;
        this.reason = reason;
    }
}
