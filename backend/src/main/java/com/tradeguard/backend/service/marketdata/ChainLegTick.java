package com.tradeguard.backend.service.marketdata;

import lombok.Builder;

import java.time.Instant;
import java.time.LocalDate;

@Builder
public record ChainLegTick(
        String symbol,
        LocalDate expiry,
        double strike,
        String optionType,
        Double bid,
        Double ask,
        Long openInterest,
        Long volume,
        Double delta,
        Double gamma,
        Double theta,
        Double vega,
        Double rho,
        Double iv,
        Instant tsFeed,
        Instant tsRecv,
        String source
) {}
