package com.tradeguard.backend.repository;

import com.tradeguard.backend.model.AuditTrailEntry;

import java.util.Optional;

public interface AuditTrailRepository extends AppendOnlyRepository<AuditTrailEntry, Long> {

    Optional<AuditTrailEntry> findFirstByRecordTypeAndRecordId(AuditTrailEntry.RecordType recordType, Long recordId);
}
