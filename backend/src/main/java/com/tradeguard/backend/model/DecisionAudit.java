package com.tradeguard.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "decision_audits")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cycle_id", nullable = false, length = 64)
    private String cycleId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(name = "strategy_id", length = 128)
    private String strategyId;

    /** WINNER, LOSER, GATE_ACCEPT or GATE_REJECT. */
    @Column(name = "decision_type", nullable = false, length = 32)
    private String decisionType;

    @Column(length = 64)
    private String reason;

    @Column
    private String details;

    @Column(name = "decision_time", nullable = false)
    private Instant decisionTime;
}
