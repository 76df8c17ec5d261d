package com.tradeguard.backend.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class PromotionPrecheckException extends RuntimeException {

    private final List<String> failures;

    public PromotionPrecheckException(List<String> failures) {
        super("Promotion precheck failed: " + String.join("; ", failures));
        this.failures = List.copyOf(failures);
    }
}
