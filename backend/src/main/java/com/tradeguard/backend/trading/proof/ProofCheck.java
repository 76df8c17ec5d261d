package com.tradeguard.backend.trading.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one sub-proof. A check that could not be evaluated never passes.
 */
public record ProofCheck(boolean passed, boolean evaluated, List<ProofReason> reasons, Map<String, Object> details) {

    public static ProofCheck notEvaluated() {
        return new ProofCheck(false, false, List.of(), Map.of());
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private final List<ProofReason> reasons = new ArrayList<>();
        private final Map<String, Object> details = new LinkedHashMap<>();

        Builder fail(String code, String message) {
            reasons.add(new ProofReason(code, message));
            return this;
        }

        Builder detail(String key, Object value) {
            if (value != null) {
                details.put(key, value);
            }
            return this;
        }

        ProofCheck build() {
            return new ProofCheck(reasons.isEmpty(), true, List.copyOf(reasons),
                    Collections.unmodifiableMap(new LinkedHashMap<>(details)));
        }
    }
}
