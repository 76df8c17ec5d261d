package com.tradeguard.backend.controller;

import com.tradeguard.backend.service.MarketHealthService;
import com.tradeguard.backend.service.MarketRecorderService;
import com.tradeguard.backend.service.marketdata.ChainLegTick;
import com.tradeguard.backend.service.marketdata.HealthSnapshot;
import com.tradeguard.backend.service.marketdata.QuoteTick;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Feed ingestion into the audit store. Writes are fire-and-forget and stamp a
 * missing receive time with the server clock.
 */
@RestController
@RequestMapping("/api/market-data")
@RequiredArgsConstructor
@Tag(name = "Market data")
public class MarketDataController {

    private final MarketRecorderService marketRecorderService;
    private final MarketHealthService marketHealthService;

    @PostMapping("/quotes")
    @Operation(summary = "Record an NBBO quote")
    public ResponseEntity<Void> recordQuote(@RequestBody QuoteTick tick) {
        marketRecorderService.recordQuote(tick);
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @PostMapping("/chain")
    @Operation(summary = "Record an option chain leg")
    public ResponseEntity<Void> recordChain(@RequestBody ChainLegTick leg) {
        marketRecorderService.recordChain(leg);
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @GetMapping("/health")
    @Operation(summary = "Quote and broker staleness")
    public ResponseEntity<HealthSnapshot> health() {
        return ResponseEntity.ok(marketHealthService.snapshot());
    }
}
