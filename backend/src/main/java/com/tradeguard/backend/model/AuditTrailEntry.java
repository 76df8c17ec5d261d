package com.tradeguard.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * Provenance stamp written alongside every audit record.
 */
@Entity
@Table(name = "audit_trail")
@Immutable
@EntityListeners(WormEntityListener.class)
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AuditTrailEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false, length = 32)
    private RecordType recordType;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Column(name = "ts_feed")
    private Instant tsFeed;

    @Column(name = "ts_recv")
    private Instant tsRecv;

    @Column(name = "server_ts", nullable = false)
    private Instant serverTs;

    @Column(name = "commit_hash", nullable = false, length = 64)
    private String commitHash;

    @Column(name = "policy_hash", nullable = false, length = 64)
    private String policyHash;

    @Column(nullable = false, length = 32)
    private String environment;

    @Column(name = "worm_mode", nullable = false)
    private boolean wormMode;

    public enum RecordType {
        QUOTE,
        CHAIN,
        ORDER,
        FILL,
        LEDGER,
        PROOF
    }
}
