package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.ChainLegSnapshot;

import java.time.Instant;
import java.util.List;

public interface ChainLegSnapshotRepository extends AppendOnlyRepository<ChainLegSnapshot, Long> {

    List<ChainLegSnapshot> findBySymbolAndTsRecvGreaterThanEqualOrderByTsRecvDesc(String symbol, Instant since);
}
