package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.QuoteSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface QuoteSnapshotRepository extends AppendOnlyRepository<QuoteSnapshot, Long> {

    Optional<QuoteSnapshot> findFirstBySymbolOrderByTsRecvDesc(String symbol);

    Optional<QuoteSnapshot> findFirstByOrderByTsRecvDesc();

    List<QuoteSnapshot> findBySymbolAndTsRecvBetweenOrderByTsRecvAsc(String symbol, Instant from, Instant to);

    List<QuoteSnapshot> findByTsRecvGreaterThanEqualAndTsRecvLessThanOrderByTsRecvAsc(Instant from, Instant to);
}
