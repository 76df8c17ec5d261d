package com.tradeguard.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong auditWriteFailures = new AtomicLong();
    private final AtomicReference<Double> poolCap = new AtomicReference<>(0.0);
    private final AtomicReference<Double> poolUtilization = new AtomicReference<>(0.0);

    private Counter proofsPassedCounter;
    private Counter proofsFailedCounter;
    private Counter criticalHeadroomCounter;
    private Counter brokerFailuresCounter;

    @PostConstruct
    void init() {
        proofsPassedCounter = Counter.builder("trade_proofs_total").tag("result", "passed").register(meterRegistry);
        proofsFailedCounter = Counter.builder("trade_proofs_total").tag("result", "failed").register(meterRegistry);
        criticalHeadroomCounter = Counter.builder("greeks_headroom_critical_total").register(meterRegistry);
        brokerFailuresCounter = Counter.builder("broker_errors_total").register(meterRegistry);
        Gauge.builder("allocator_pool_cap", poolCap, AtomicReference::get).register(meterRegistry);
        Gauge.builder("allocator_pool_utilization", poolUtilization, AtomicReference::get).register(meterRegistry);
    }

    public void recordAuditWriteFailure(String recordType) {
        auditWriteFailures.incrementAndGet();
        Counter.builder("audit_write_failures_total")
                .tag("record_type", recordType)
                .register(meterRegistry)
                .increment();
    }

    public long auditWriteFailures() {
        return auditWriteFailures.get();
    }

    public void recordGateDecision(String decision, String reason) {
        Counter.builder("gate_decisions_total")
                .tag("decision", decision)
                .tag("reason", reason == null ? "none" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordProof(boolean passed, boolean critical) {
        Counter counter = passed ? proofsPassedCounter : proofsFailedCounter;
        if (counter != null) {
            counter.increment();
        }
        if (critical && criticalHeadroomCounter != null) {
            criticalHeadroomCounter.increment();
        }
    }

    public void recordBrokerFailure() {
        if (brokerFailuresCounter != null) {
            brokerFailuresCounter.increment();
        }
    }

    public void updatePool(double cap, double utilization) {
        poolCap.set(cap);
        poolUtilization.set(utilization);
    }
}
