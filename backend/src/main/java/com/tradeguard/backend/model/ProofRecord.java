package com.tradeguard.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Persisted outcome of one post-trade verification.
 */
@Entity
@Table(name = "trade_proofs")
@Immutable
@EntityListeners(WormEntityListener.class)
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ProofRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_id", nullable = false, length = 64)
    private String tradeId;

    @Column(name = "plan_id", length = 64)
    private String planId;

    @Column(length = 32)
    private String symbol;

    @Column(length = 64)
    private String route;

    @Column(nullable = false)
    private boolean passed;

    @Column(name = "using_fallback", nullable = false)
    private boolean usingFallback;

    @Column(name = "slippage_within_plan", nullable = false)
    private boolean slippageWithinPlan;

    @Column(name = "real_slippage")
    private Double realSlippage;

    @Column(name = "critical_headroom_alert", nullable = false)
    private boolean criticalHeadroomAlert;

    @Column(length = 4000)
    private String reasons;

    @Column(name = "proof_json")
    private String proofJson;

    @Column(name = "verified_at", nullable = false)
    private Instant verifiedAt;
}
