package com.tradeguard.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.backend.model.DecisionAudit;
import com.tradeguard.backend.repository.DecisionAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class DecisionAuditService {

    public static final String WINNER = "WINNER";
    public static final String LOSER = "LOSER";
    public static final String GATE_ACCEPT = "GATE_ACCEPT";
    public static final String GATE_REJECT = "GATE_REJECT";

    private final DecisionAuditRepository decisionAuditRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void record(String cycleId, String symbol, String strategyId, String decisionType, String reason,
                       Map<String, Object> details) {
        String json = null;
        try {
            json = objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize decision audit for {}", decisionType, e);
        }
        try {
            decisionAuditRepository.save(DecisionAudit.builder()
                    .cycleId(cycleId)
                    .symbol(symbol)
                    .strategyId(strategyId)
                    .decisionType(decisionType)
                    .reason(reason)
                    .details(json)
                    .decisionTime(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to record decision audit cycle={} symbol={} type={}: {}", cycleId, symbol, decisionType,
                    e.getMessage());
        }
    }

    public List<DecisionAudit> forCycle(String cycleId) {
        return decisionAuditRepository.findByCycleIdOrderByIdAsc(cycleId);
    }
}
