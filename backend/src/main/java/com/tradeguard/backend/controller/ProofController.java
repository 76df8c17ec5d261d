package com.tradeguard.backend.controller;

import com.tradeguard.backend.dto.VerifyRequest;
import com.tradeguard.backend.trading.proof.PostTradeProver;
import com.tradeguard.backend.trading.proof.Proof;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/proofs")
@RequiredArgsConstructor
@Tag(name = "Proofs")
public class ProofController {

    private final PostTradeProver prover;

    @PostMapping("/verify")
    @Operation(summary = "Verify a fact against a promise without recording the result")
    public ResponseEntity<Proof> verify(@RequestBody VerifyRequest request) {
        return ResponseEntity.ok(prover.verifyExecution(request.promise(), request.fact()));
    }
}
