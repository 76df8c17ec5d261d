package com.tradeguard.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "allocations", uniqueConstraints = {
        @UniqueConstraint(name = "uk_allocations_token", columnNames = {"session_id", "strategy_ref", "consistency_token"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Allocation {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "session_id", nullable = false, length = 128)
    private String sessionId;

    @Column(name = "strategy_ref", nullable = false, length = 128)
    private String strategyRef;

    @Column(nullable = false, length = 32)
    private String pool;

    /** Fraction of equity, in (0, 1]. */
    @Column(name = "allocation_fraction", nullable = false)
    private double allocation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(name = "status_reason", length = 256)
    private String statusReason;

    @Column(name = "ttl_until", nullable = false)
    private Instant ttlUntil;

    @Column(name = "consistency_token", nullable = false, length = 128)
    private String consistencyToken;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public enum Status {
        STAGED,
        ACTIVE,
        EXPIRED,
        FROZEN;

        public boolean isTerminal() {
            return this == EXPIRED || this == FROZEN;
        }

        public boolean canTransitionTo(Status next) {
            return switch (this) {
                case STAGED -> next == ACTIVE || next == EXPIRED;
                case ACTIVE -> next == EXPIRED || next == FROZEN;
                case EXPIRED, FROZEN -> false;
            };
        }
    }

    public void transitionTo(Status next, String reason, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Allocation " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.statusReason = reason;
        this.updatedAt = at;
    }
}
