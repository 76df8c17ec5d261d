package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.LedgerSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface LedgerSnapshotRepository extends AppendOnlyRepository<LedgerSnapshot, Long> {

    List<LedgerSnapshot> findByTsChangeGreaterThanEqualAndTsChangeLessThanOrderByTsChangeAsc(Instant from, Instant to);

    Optional<LedgerSnapshot> findFirstByOrderByTsChangeDesc();
}
