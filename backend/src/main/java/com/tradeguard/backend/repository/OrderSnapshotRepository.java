package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.OrderSnapshot;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface OrderSnapshotRepository extends AppendOnlyRepository<OrderSnapshot, Long> {

    Optional<OrderSnapshot> findFirstByPlanIdOrderByTsCreatedDesc(String planId);

    List<OrderSnapshot> findByPlanIdIn(Collection<String> planIds);
}
