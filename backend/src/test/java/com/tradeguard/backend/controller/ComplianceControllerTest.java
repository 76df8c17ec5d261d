package com.tradeguard.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ComplianceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void trailingSummaryCoversRequestedWindow() throws Exception {
        mockMvc.perform(get("/api/compliance/summary").param("hours", "6"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.windowHours").value(6))
                .andExpect(jsonPath("$.dataAvailable").value(true))
                .andExpect(jsonPath("$.summary").isNotEmpty());
    }

    @Test
    void nonPositiveWindowIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/compliance/summary").param("hours", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }
}
