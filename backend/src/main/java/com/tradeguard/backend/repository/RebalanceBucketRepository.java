package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.RebalanceBucket;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RebalanceBucketRepository extends JpaRepository<RebalanceBucket, String> {

    Optional<RebalanceBucket> findByConsistencyToken(String consistencyToken);

    List<RebalanceBucket> findByStatusAndStartedAtBefore(RebalanceBucket.Status status, Instant cutoff);
}
