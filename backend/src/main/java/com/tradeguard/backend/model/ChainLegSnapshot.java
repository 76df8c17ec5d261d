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
import java.time.LocalDate;

@Entity
@Table(name = "chains_snapshot")
@Immutable
@EntityListeners(WormEntityListener.class)
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ChainLegSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(nullable = false)
    private LocalDate expiry;

    @Column(nullable = false)
    private double strike;

    @Column(name = "option_type", nullable = false, length = 8)
    private String optionType;

    private Double bid;
    private Double ask;

    @Column(name = "open_interest")
    private Long openInterest;

    private Long volume;
    private Double delta;
    private Double gamma;
    private Double theta;
    private Double vega;
    private Double rho;
    private Double iv;

    @Column(name = "ts_feed")
    private Instant tsFeed;

    @Column(name = "ts_recv", nullable = false)
    private Instant tsRecv;

    @Column(length = 64)
    private String source;
}
