package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.AuditAction;
import com.tradeguard.backend.model.AuditEvent;

import java.util.List;

public interface AuditEventRepository extends AppendOnlyRepository<AuditEvent, Long> {

    List<AuditEvent> findBySubjectRefOrderByCreatedAtAscIdAsc(String subjectRef);

    List<AuditEvent> findByActionOrderByCreatedAtAsc(AuditAction action);
}
