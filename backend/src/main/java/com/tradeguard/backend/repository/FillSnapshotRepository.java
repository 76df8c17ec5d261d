package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.FillSnapshot;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface FillSnapshotRepository extends AppendOnlyRepository<FillSnapshot, Long> {

    List<FillSnapshot> findByPlanIdOrderByTsFillAsc(String planId);

    List<FillSnapshot> findByTsFillGreaterThanEqualAndTsFillLessThanOrderByTsFillAsc(Instant from, Instant to);

    List<FillSnapshot> findByAllocationIdInOrderByTsFillAsc(Collection<String> allocationIds);
}
