package com.tradeguard.backend.dto;

import com.tradeguard.backend.trading.proof.PostTradeFact;
import com.tradeguard.backend.trading.proof.PreTradePromise;

/**
 * Ad-hoc verification input. Either part may be absent; the proof then reports it unproven.
 */
public record VerifyRequest(PreTradePromise promise, PostTradeFact fact) {}
