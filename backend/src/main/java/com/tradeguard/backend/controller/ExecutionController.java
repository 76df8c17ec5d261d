package com.tradeguard.backend.controller;

import com.tradeguard.backend.dto.ExecutionRequest;
import com.tradeguard.backend.dto.ExecutionResult;
import com.tradeguard.backend.service.TradeExecutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
@Tag(name = "Executions")
public class ExecutionController {

    private final TradeExecutionService tradeExecutionService;

    @PostMapping
    @Operation(summary = "Execute a gated order and prove it")
    public ResponseEntity<ExecutionResult> execute(@Valid @RequestBody ExecutionRequest request) {
        log.info("Executing plan {} {} {} x{}", request.getPlanId(), request.getSide(), request.getSymbol(),
                request.getQuantity());
        return ResponseEntity.ok(tradeExecutionService.execute(request));
    }
}
