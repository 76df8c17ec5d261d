package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.ProofRecord;

import java.time.Instant;
import java.util.List;

public interface ProofRecordRepository extends AppendOnlyRepository<ProofRecord, Long> {

    List<ProofRecord> findByVerifiedAtGreaterThanEqualAndVerifiedAtLessThanOrderByVerifiedAtAsc(Instant from, Instant to);
}
