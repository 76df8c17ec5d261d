package com.tradeguard.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Marker guaranteeing an hour bucket is rebalanced at most once.
 */
@Entity
@Table(name = "rebalance_buckets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceBucket {

    /** UTC hour, formatted {@code yyyy-MM-dd_HH}. */
    @Id
    @Column(length = 16)
    private String bucket;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(name = "consistency_token", length = 128, unique = true)
    private String consistencyToken;

    @Column(name = "pool_cap")
    private Double poolCap;

    @Column(name = "result_json")
    private String resultJson;

    @Column(name = "error_message", length = 512)
    private String errorMessage;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;

    public enum Status {
        IN_PROGRESS,
        COMPLETED,
        FAILED
    }
}
