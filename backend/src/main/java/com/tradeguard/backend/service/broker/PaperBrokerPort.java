package com.tradeguard.backend.service.broker;

import com.tradeguard.backend.exception.BrokerExecutionException;
import com.tradeguard.backend.model.QuoteSnapshot;
import com.tradeguard.backend.service.MarketRecorderService;
import com.tradeguard.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * In-process broker that fills immediately at the recorded NBBO: buys at the ask,
 * sells at the bid. Refuses to fill without a fresh quote.
 */
@Slf4j
@Service
public class PaperBrokerPort implements BrokerPort {

    private final MarketRecorderService marketRecorderService;
    private final Clock clock;
    private final BigDecimal feePerUnit;

    public PaperBrokerPort(MarketRecorderService marketRecorderService, Clock clock,
                           @Value("${broker.paper.fee-per-unit:0.01}") double feePerUnit) {
        this.marketRecorderService = marketRecorderService;
        this.clock = clock;
        this.feePerUnit = MoneyUtils.bd(feePerUnit);
    }

    @Override
    public BrokerExecution submit(BrokerOrderRequest request) {
        if (request.quantity() <= 0) {
            throw new BrokerExecutionException("Paper broker rejected order " + request.planId() + ": quantity must be positive");
        }
        QuoteSnapshot quote = marketRecorderService.latestFreshQuote(request.symbol())
                .orElseThrow(() -> new BrokerExecutionException("No fresh quote to fill " + request.symbol()));
        boolean buy = request.side() != null && request.side().toUpperCase().startsWith("BUY");
        double price = buy ? quote.getAsk() : quote.getBid();
        if (request.limitPrice() != null && (buy ? price > request.limitPrice() : price < request.limitPrice())) {
            throw new BrokerExecutionException(String.format("Paper broker could not fill %s at limit %.4f (market %.4f)",
                    request.symbol(), request.limitPrice(), price));
        }
        Instant filledAt = clock.instant();
        String orderId = "PAPER-" + UUID.randomUUID();
        BrokerExecution execution = new BrokerExecution(
                orderId,
                request.planId(),
                request.symbol(),
                request.side(),
                MoneyUtils.bd(price),
                request.quantity(),
                MoneyUtils.multiply(feePerUnit, request.quantity()),
                filledAt,
                "paper:" + orderId + "@" + filledAt);
        log.info("Paper fill plan={} symbol={} side={} qty={} price={}", request.planId(), request.symbol(),
                request.side(), request.quantity(), execution.price());
        return execution;
    }

    @Override
    public Instant lastHeartbeat() {
        return clock.instant();
    }
}
