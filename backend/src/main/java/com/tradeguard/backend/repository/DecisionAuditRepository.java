package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.DecisionAudit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DecisionAuditRepository extends JpaRepository<DecisionAudit, Long> {

    List<DecisionAudit> findByCycleIdOrderByIdAsc(String cycleId);
}
