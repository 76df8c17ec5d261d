package com.tradeguard.backend.controller;

import com.tradeguard.backend.dto.FreezeRequest;
import com.tradeguard.backend.dto.FreezeResult;
import com.tradeguard.backend.dto.LedgerView;
import com.tradeguard.backend.dto.PoolStatus;
import com.tradeguard.backend.dto.PrecheckResult;
import com.tradeguard.backend.dto.RebalanceResult;
import com.tradeguard.backend.dto.StageRequest;
import com.tradeguard.backend.dto.StrategyPerformance;
import com.tradeguard.backend.model.Allocation;
import com.tradeguard.backend.model.AuditEvent;
import com.tradeguard.backend.service.AuditEventService;
import com.tradeguard.backend.service.CapitalAllocatorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api/allocations")
@RequiredArgsConstructor
@Tag(name = "Allocations")
public class AllocationController {

    private final CapitalAllocatorService allocatorService;
    private final AuditEventService auditEventService;

    @PostMapping("/stage")
    @Operation(summary = "Stage a strategy allocation")
    public ResponseEntity<Allocation> stage(@Valid @RequestBody StageRequest request) {
        log.info("Staging allocation session={} strategy={}", request.getSessionId(), request.getStrategyRef());
        return ResponseEntity.status(HttpStatus.CREATED).body(allocatorService.stage(request));
    }

    @PostMapping("/rebalance")
    @Operation(summary = "Preview or execute the hourly rebalance")
    public ResponseEntity<RebalanceResult> rebalance(
            @RequestParam(defaultValue = "preview") String mode,
            @RequestParam(required = false) String token,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {
        String consistencyToken = token != null && !token.isBlank() ? token : idempotencyKey;
        return ResponseEntity.ok(allocatorService.rebalance(parseMode(mode), consistencyToken));
    }

    @GetMapping("/ledger")
    @Operation(summary = "Allocations with realized and unrealized PnL")
    public ResponseEntity<LedgerView> ledger() {
        return ResponseEntity.ok(allocatorService.ledger());
    }

    @GetMapping("/pool-status")
    @Operation(summary = "Pool cap utilisation and risk level")
    public ResponseEntity<PoolStatus> poolStatus() {
        return ResponseEntity.ok(allocatorService.poolStatus());
    }

    @GetMapping("/precheck")
    @Operation(summary = "Dry-run promotion precheck")
    public ResponseEntity<PrecheckResult> precheck(@RequestParam(required = false) Double sharpe,
                                                   @RequestParam(required = false) Double maxDrawdown,
                                                   @RequestParam(required = false) Double winRate,
                                                   @RequestParam(required = false) Integer trades,
                                                   @RequestParam(required = false) Double avgSlippageBps,
                                                   @RequestParam(required = false) Double traceCompleteness) {
        StrategyPerformance performance = StrategyPerformance.builder()
                .sharpe(sharpe)
                .maxDrawdown(maxDrawdown)
                .winRate(winRate)
                .trades(trades)
                .avgSlippageBps(avgSlippageBps)
                .traceCompleteness(traceCompleteness)
                .build();
        return ResponseEntity.ok(allocatorService.precheck(performance));
    }

    @GetMapping("/{allocationId}/history")
    @Operation(summary = "Audit events recorded for one allocation")
    public ResponseEntity<List<AuditEvent>> history(@PathVariable String allocationId) {
        return ResponseEntity.ok(auditEventService.history(allocationId));
    }

    @PostMapping("/freeze")
    @Operation(summary = "Emergency freeze of all active allocations")
    public ResponseEntity<FreezeResult> freeze(@Valid @RequestBody FreezeRequest request) {
        return ResponseEntity.ok(allocatorService.emergencyFreeze(request.getReason()));
    }

    private static RebalanceResult.RebalanceMode parseMode(String mode) {
        try {
            return RebalanceResult.RebalanceMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rebalance mode '" + mode + "', expected preview or execute");
        }
    }
}
