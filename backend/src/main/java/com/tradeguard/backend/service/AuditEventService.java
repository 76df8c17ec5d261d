package com.tradeguard.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.backend.dto.AuditStamp;
import com.tradeguard.backend.model.AuditAction;
import com.tradeguard.backend.model.AuditEvent;
import com.tradeguard.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Operator event log. Writing an event never fails the operation it describes;
 * a lost event is logged and counted instead.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    private static final int MAX_DESCRIPTION = 512;

    private final AuditEventRepository auditEventRepository;
    private final AuditStampFactory auditStampFactory;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;

    public void record(AuditAction action, String subjectRef, String description, Map<String, ?> metadata) {
        try {
            AuditStamp stamp = auditStampFactory.stamp();
            auditEventRepository.save(AuditEvent.builder()
                    .category(action.category())
                    .action(action)
                    .subjectRef(subjectRef)
                    .description(truncate(description))
                    .metadata(metadata == null || metadata.isEmpty() ? null : objectMapper.writeValueAsString(metadata))
                    .correlationId(MDC.get("correlationId"))
                    .commitHash(stamp.commitHash())
                    .policyHash(stamp.policyHash())
                    .createdAt(stamp.serverTs())
                    .build());
        } catch (JsonProcessingException | DataAccessException e) {
            metricsService.recordAuditWriteFailure("AUDIT_EVENT");
            log.warn("Lost audit event {} for {}: {}", action, subjectRef, e.getMessage());
        }
    }

    public List<AuditEvent> history(String subjectRef) {
        return auditEventRepository.findBySubjectRefOrderByCreatedAtAscIdAsc(subjectRef);
    }

    private static String truncate(String description) {
        if (description == null || description.length() <= MAX_DESCRIPTION) {
            return description;
        }
        return description.substring(0, MAX_DESCRIPTION - 3) + "...";
    }
}
