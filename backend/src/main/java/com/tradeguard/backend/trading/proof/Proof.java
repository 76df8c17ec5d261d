package com.tradeguard.backend.trading.proof;

import com.tradeguard.backend.dto.AuditStamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Proof(
        String tradeId,
        String planId,
        String symbol,
        Instant verifiedAt,
        AuditStamp auditStamp,
        ProofCheck promiseIntegrity,
        ProofCheck execution,
        ProofCheck structure,
        ProofCheck cash,
        ProofCheck greeks,
        ProofCheck netDebitOnly,
        ProofCheck sidesOk,
        ProofCheck slippageWithinPlan,
        ProofCheck greeksCapsWithin,
        Overall overall,
        boolean criticalHeadroomAlert,
        boolean usingFallback,
        Double realSlippage
) {

    public record Overall(boolean passed, List<ProofReason> reasons) {}

    /** Sub-proofs in reporting order. */
    public Map<String, ProofCheck> checks() {
        Map<String, ProofCheck> checks = new LinkedHashMap<>();
        checks.put("promiseIntegrity", promiseIntegrity);
        checks.put("execution", execution);
        checks.put("structure", structure);
        checks.put("cash", cash);
        checks.put("greeks", greeks);
        checks.put("netDebitOnly", netDebitOnly);
        checks.put("sidesOk", sidesOk);
        checks.put("slippageWithinPlan", slippageWithinPlan);
        checks.put("greeksCapsWithin", greeksCapsWithin);
        return checks;
    }

    static Overall aggregate(List<ProofCheck> checks) {
        boolean passed = true;
        List<ProofReason> reasons = new ArrayList<>();
        for (ProofCheck check : checks) {
            passed &= check.passed();
            reasons.addAll(check.reasons());
        }
        return new Overall(passed, List.copyOf(reasons));
    }
}
