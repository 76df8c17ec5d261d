package com.tradeguard.backend.trading.proof;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Recorded market facts the prover checks executions against.
 */
public interface ExecutionEvidence {

    Optional<NbboQuote> nbboAt(String symbol, Instant timestamp, Duration tolerance);

    Optional<Double> plannedMaxSlippage(String planId);
}
