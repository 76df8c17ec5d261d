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
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

@Entity
@Table(name = "quotes_snapshot")
@Immutable
@EntityListeners(WormEntityListener.class)
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class QuoteSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(nullable = false)
    private double bid;

    @Column(nullable = false)
    private double ask;

    @Column(nullable = false)
    private double mid;

    @Column(name = "ts_feed")
    private Instant tsFeed;

    @Column(name = "ts_recv", nullable = false)
    private Instant tsRecv;

    @Column(length = 64)
    private String source;
}
