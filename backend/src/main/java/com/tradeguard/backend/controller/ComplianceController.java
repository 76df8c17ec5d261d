package com.tradeguard.backend.controller;

import com.tradeguard.backend.dto.ComplianceSummary;
import com.tradeguard.backend.service.ComplianceSummaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/compliance")
@RequiredArgsConstructor
@Tag(name = "Compliance")
public class ComplianceController {

    private final ComplianceSummaryService complianceSummaryService;

    @GetMapping("/summary")
    @Operation(summary = "Trailing compliance summary")
    public ResponseEntity<ComplianceSummary> summary(@RequestParam(defaultValue = "24") int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be positive");
        }
        return ResponseEntity.ok(complianceSummaryService.summarizeTrailing(Duration.ofHours(hours)));
    }
}
