package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.Allocation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AllocationRepository extends JpaRepository<Allocation, String> {

    Optional<Allocation> findBySessionIdAndStrategyRefAndConsistencyToken(String sessionId, String strategyRef,
                                                                          String consistencyToken);

    List<Allocation> findByStatusOrderByCreatedAtAsc(Allocation.Status status);

    List<Allocation> findByStatusInOrderByCreatedAtAsc(Collection<Allocation.Status> statuses);
}
