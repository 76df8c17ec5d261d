package com.tradeguard.backend.dto;

import com.tradeguard.backend.service.broker.BrokerPort;
import com.tradeguard.backend.trading.proof.Proof;

public record ExecutionResult(BrokerPort.BrokerExecution execution, double cashBefore, double cashAfter, Proof proof) {}
