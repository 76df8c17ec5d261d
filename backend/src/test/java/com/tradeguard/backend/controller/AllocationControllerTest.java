package com.tradeguard.backend.controller;

import com.tradeguard.backend.config.RequestCorrelationFilter;
import com.tradeguard.backend.dto.RebalanceResult;
import com.tradeguard.backend.exception.ConflictException;
import com.tradeguard.backend.exception.FailClosedException;
import com.tradeguard.backend.exception.PromotionPrecheckException;
import com.tradeguard.backend.service.CapitalAllocatorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AllocationControllerTest {

    private static final String STAGE_BODY = """
            {
              "sessionId": "session-1",
              "strategyRef": "strat-a",
              "allocation": %s,
              "consistencyToken": "tok-1",
              "performance": {
                "sharpe": 1.5,
                "maxDrawdown": 0.08,
                "winRate": 0.55,
                "trades": 40,
                "avgSlippageBps": 5.0,
                "traceCompleteness": 0.99
              }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CapitalAllocatorService allocatorService;

    @Test
    void stageRejectsAllocationAboveOne() throws Exception {
        mockMvc.perform(post("/api/allocations/stage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(STAGE_BODY.formatted("1.5")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details[0].field").value("allocation"));
        verifyNoInteractions(allocatorService);
    }

    @Test
    void staleMarketDataMapsToUnprocessableEntity() throws Exception {
        when(allocatorService.stage(any())).thenThrow(
                new FailClosedException("NBBO_STALE", "last quote 900s old", "Cannot stage without recent NBBO data"));

        mockMvc.perform(post("/api/allocations/stage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(STAGE_BODY.formatted("0.02")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("NBBO_STALE"))
                .andExpect(jsonPath("$.failClosedReason").value("last quote 900s old"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void precheckFailuresAreItemized() throws Exception {
        when(allocatorService.stage(any())).thenThrow(
                new PromotionPrecheckException(List.of("sharpe 0.40 < 1.20", "trades 10 < 25")));

        mockMvc.perform(post("/api/allocations/stage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(STAGE_BODY.formatted("0.02")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("PRECHECK_FAILED"))
                .andExpect(jsonPath("$.details.length()").value(2));
    }

    @Test
    void rebalanceFallsBackToIdempotencyKeyHeader() throws Exception {
        when(allocatorService.rebalance(any(), any())).thenReturn(RebalanceResult.builder()
                .bucket("2026-03-02_10")
                .mode(RebalanceResult.RebalanceMode.EXECUTE)
                .poolCap(0.05)
                .activated(List.of())
                .rejected(List.of())
                .expired(List.of())
                .computedAt(Instant.parse("2026-03-02T10:15:00Z"))
                .build());

        mockMvc.perform(post("/api/allocations/rebalance")
                        .param("mode", "execute")
                        .header("Idempotency-Key", "key-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bucket").value("2026-03-02_10"))
                .andExpect(jsonPath("$.poolCap").value(0.05));

        verify(allocatorService).rebalance(eq(RebalanceResult.RebalanceMode.EXECUTE), eq("key-1"));
    }

    @Test
    void bucketInProgressIsRetryableConflict() throws Exception {
        when(allocatorService.rebalance(any(), any()))
                .thenThrow(new ConflictException("Rebalance bucket 2026-03-02_10 is already in progress"));

        mockMvc.perform(post("/api/allocations/rebalance")
                        .param("mode", "execute")
                        .header(RequestCorrelationFilter.CORRELATION_ID_HEADER, "ops-run-7"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CONFLICT"))
                .andExpect(jsonPath("$.retryable").value(true))
                .andExpect(jsonPath("$.correlationId").value("ops-run-7"))
                .andExpect(header().string(RequestCorrelationFilter.CORRELATION_ID_HEADER, "ops-run-7"));
    }

    @Test
    void unusableCorrelationHeaderIsReplaced() throws Exception {
        mockMvc.perform(post("/api/allocations/rebalance")
                        .param("mode", "apply")
                        .header(RequestCorrelationFilter.CORRELATION_ID_HEADER, "not a valid id; drop table"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string(RequestCorrelationFilter.CORRELATION_ID_HEADER,
                        matchesPattern("[0-9a-f-]{36}")));
    }

    @Test
    void unknownRebalanceModeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/allocations/rebalance").param("mode", "apply"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
        verifyNoInteractions(allocatorService);
    }

    @Test
    void freezeRequiresReason() throws Exception {
        mockMvc.perform(post("/api/allocations/freeze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }
}
