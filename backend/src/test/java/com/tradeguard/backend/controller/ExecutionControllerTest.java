package com.tradeguard.backend.controller;

import com.tradeguard.backend.exception.FailClosedException;
import com.tradeguard.backend.service.TradeExecutionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ExecutionControllerTest {

    private static final String ORDER_BODY = """
            {
              "planId": "plan-1",
              "symbol": "SPY",
              "side": "BUY_TO_OPEN",
              "quantity": %s,
              "limitPrice": 5.00,
              "plannedMaxSlip": 0.06,
              "strategyId": "stratA"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TradeExecutionService tradeExecutionService;

    @Test
    void gateRefusalIsUnprocessable() throws Exception {
        when(tradeExecutionService.execute(any())).thenThrow(new FailClosedException("GATE_REJECTED", "STALE_DATA",
                "Order plan-1 refused by pre-trade gate: Market data flagged stale"));

        mockMvc.perform(post("/api/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ORDER_BODY.formatted("10")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("GATE_REJECTED"))
                .andExpect(jsonPath("$.failClosedReason").value("STALE_DATA"));
    }

    @Test
    void zeroQuantityFailsValidation() throws Exception {
        mockMvc.perform(post("/api/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ORDER_BODY.formatted("0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
        verifyNoInteractions(tradeExecutionService);
    }
}
