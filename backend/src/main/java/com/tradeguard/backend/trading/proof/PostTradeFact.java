package com.tradeguard.backend.trading.proof;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * What actually happened at the broker, as reported for one executed trade.
 */
@Builder(toBuilder = true)
public record PostTradeFact(
        String id,
        String planId,
        String symbol,
        String side,
        String optionType,
        Double price,
        Integer qty,
        Integer requestedQty,
        Double fees,
        Instant timestamp,
        Double netDebit,
        Double totalCost,
        Double cashBefore,
        Double cashAfter,
        Double actualSlippage,
        Greeks portfolioGreeks,
        List<String> sides,
        String brokerAttestation,
        String allocationId,
        String route,
        Boolean entry
) {

    public String planIdOrId() {
        return planId != null && !planId.isBlank() ? planId : id;
    }

    public boolean isEntry() {
        return entry == null || entry;
    }
}
