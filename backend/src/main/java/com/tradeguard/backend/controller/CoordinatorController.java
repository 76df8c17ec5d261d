package com.tradeguard.backend.controller;

import com.tradeguard.backend.dto.CycleRequest;
import com.tradeguard.backend.dto.CycleResult;
import com.tradeguard.backend.exception.NotFoundException;
import com.tradeguard.backend.service.TradingCycleService;
import com.tradeguard.backend.trading.coordinator.CoordinatorStats;
import com.tradeguard.backend.trading.coordinator.DecisionCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/coordinator")
@RequiredArgsConstructor
@Tag(name = "Coordinator")
public class CoordinatorController {

    private final TradingCycleService tradingCycleService;
    private final DecisionCoordinator decisionCoordinator;

    @PostMapping("/cycle")
    @Operation(summary = "Run one coordination and gating cycle")
    public ResponseEntity<CycleResult> runCycle(@Valid @RequestBody CycleRequest request) {
        return ResponseEntity.ok(tradingCycleService.runCycle(request));
    }

    @GetMapping("/last-cycle")
    @Operation(summary = "Most recent cycle result")
    public ResponseEntity<CycleResult> lastCycle() {
        return tradingCycleService.lastResult()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No coordination cycle has run yet"));
    }

    @GetMapping("/stats")
    @Operation(summary = "Coordinator counters since startup")
    public ResponseEntity<CoordinatorStats> stats() {
        return ResponseEntity.ok(decisionCoordinator.getStats());
    }
}
