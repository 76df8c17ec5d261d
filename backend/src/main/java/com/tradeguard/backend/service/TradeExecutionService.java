package com.tradeguard.backend.service;

import com.tradeguard.backend.dto.ExecutionRequest;
import com.tradeguard.backend.dto.ExecutionResult;
import com.tradeguard.backend.exception.BadRequestException;
import com.tradeguard.backend.exception.BrokerExecutionException;
import com.tradeguard.backend.exception.FailClosedException;
import com.tradeguard.backend.model.AuditAction;
import com.tradeguard.backend.service.broker.BrokerPort;
import com.tradeguard.backend.service.marketdata.FillEvent;
import com.tradeguard.backend.service.marketdata.HealthSnapshot;
import com.tradeguard.backend.service.marketdata.LedgerChange;
import com.tradeguard.backend.service.marketdata.OrderPlan;
import com.tradeguard.backend.trading.gate.GateContext;
import com.tradeguard.backend.trading.gate.GateDecision;
import com.tradeguard.backend.trading.gate.GateRejectReason;
import com.tradeguard.backend.trading.gate.PreTradeGate;
import com.tradeguard.backend.trading.proof.PostTradeFact;
import com.tradeguard.backend.trading.proof.PostTradeProver;
import com.tradeguard.backend.trading.proof.Proof;
import com.tradeguard.backend.util.MoneyUtils;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs an order through the pre-trade gate, sends the admitted quantity to the
 * broker, records order, fill and cash movement, then proves the execution
 * against its promise. Gate refusals and broker failures propagate to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutionService {

    private final PreTradeGate gate;
    private final MarketHealthService marketHealthService;
    private final MarketRecorderService marketRecorderService;
    private final BrokerPort brokerPort;
    private final CircuitBreaker brokerCircuitBreaker;
    private final ProductionPerformanceService performanceService;
    private final PostTradeProver prover;
    private final MetricsService metricsService;
    private final AuditEventService auditEventService;
    private final Clock clock;

    private final Object ledgerLock = new Object();

    public ExecutionResult execute(ExecutionRequest request) {
        validate(request);
        boolean entry = isEntry(request);
        int quantity = admit(request, entry);
        marketRecorderService.recordOrder(new OrderPlan(request.getPlanId(), request.getSymbol(), request.getRoute(),
                request.getLadders() == null ? List.of() : request.getLadders(), request.getPlannedMaxSlip(),
                clock.instant())).join();

        BrokerPort.BrokerExecution execution = submit(request, quantity);
        boolean buy = isBuy(execution.side());
        BigDecimal notional = MoneyUtils.multiply(execution.price(), execution.filledQty());
        BigDecimal totalCost = MoneyUtils.add(notional, execution.fees());

        BigDecimal cashBefore;
        BigDecimal cashAfter;
        synchronized (ledgerLock) {
            cashBefore = MoneyUtils.bd(performanceService.currentEquity());
            cashAfter = buy
                    ? MoneyUtils.subtract(cashBefore, totalCost)
                    : MoneyUtils.subtract(MoneyUtils.add(cashBefore, notional), execution.fees());
            marketRecorderService.recordLedgerChange(new LedgerChange(cashBefore, cashAfter,
                    (buy ? "BUY " : "SELL ") + execution.symbol(), request.getPlanId(), execution.filledAt())).join();
        }
        marketRecorderService.recordFill(new FillEvent(request.getPlanId(), execution.symbol(), execution.side(),
                execution.price(), execution.filledQty(), execution.fees(), execution.filledAt(),
                execution.attestation(), request.getAllocationId()));

        PostTradeFact fact = toFact(request, execution, quantity, entry, totalCost, cashBefore, cashAfter);
        Proof proof = prover.verifyExecution(request.getPromise(), fact);
        metricsService.recordProof(proof.overall().passed(), proof.criticalHeadroomAlert());
        marketRecorderService.recordProof(proof, request.getRoute());
        if (!proof.overall().passed()) {
            log.warn("Execution {} did not prove:\n{}", request.getPlanId(), prover.proofSummary(proof));
            auditEventService.record(AuditAction.PROOF_FAILED, request.getPlanId(),
                    "Post-trade proof failed for " + execution.symbol(),
                    Map.of("reasons", proof.overall().reasons().size(), "usingFallback", proof.usingFallback()));
        }
        return new ExecutionResult(execution, MoneyUtils.toDouble(cashBefore), MoneyUtils.toDouble(cashAfter), proof);
    }

    /**
     * @return the quantity the gate admits, never more than requested
     */
    private int admit(ExecutionRequest request, boolean entry) {
        HealthSnapshot health = marketHealthService.snapshot();
        GateContext context = TradingCycleService.gateContext(request.getSymbol(), request.getStrategyId(),
                request.getQuantity().doubleValue(), request.getLimitPrice(), request.getPortfolio(), health);
        GateDecision decision = entry ? gate.evaluate(context) : gate.evaluateExit(context);
        metricsService.recordGateDecision(decision.decision().name(),
                decision.reason() == null ? null : decision.reason().name());

        int routed = decision.accepted() ? (int) Math.floor(decision.routedQty()) : 0;
        if (routed < 1) {
            GateRejectReason reason = decision.reason() != null ? decision.reason() : GateRejectReason.SIZE_ZERO;
            String message = decision.accepted() ? "Routed quantity rounds to zero contracts" : decision.message();
            auditEventService.record(AuditAction.ORDER_GATE_REJECTED, request.getPlanId(), message,
                    Map.of("reason", reason.name(), "entry", entry, "requestedQty", request.getQuantity()));
            throw new FailClosedException("GATE_REJECTED", reason.name(),
                    "Order " + request.getPlanId() + " refused by pre-trade gate: " + message);
        }
        if (routed < request.getQuantity()) {
            log.info("Order {} sized down by gate from {} to {}", request.getPlanId(), request.getQuantity(), routed);
        }
        return routed;
    }

    private BrokerPort.BrokerExecution submit(ExecutionRequest request, int quantity) {
        BrokerPort.BrokerOrderRequest order = new BrokerPort.BrokerOrderRequest(request.getPlanId(),
                request.getSymbol(), request.getSide(), quantity, request.getLimitPrice());
        Supplier<BrokerPort.BrokerExecution> decorated =
                CircuitBreaker.decorateSupplier(brokerCircuitBreaker, () -> brokerPort.submit(order));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            metricsService.recordBrokerFailure();
            throw new BrokerExecutionException("Broker circuit open, order " + request.getPlanId() + " not sent", e);
        } catch (BrokerExecutionException e) {
            metricsService.recordBrokerFailure();
            throw e;
        } catch (RuntimeException e) {
            metricsService.recordBrokerFailure();
            throw new BrokerExecutionException("Broker submission failed for " + request.getPlanId(), e);
        }
    }

    private static PostTradeFact toFact(ExecutionRequest request, BrokerPort.BrokerExecution execution, int routedQty,
                                        boolean entry, BigDecimal totalCost, BigDecimal cashBefore,
                                        BigDecimal cashAfter) {
        double price = MoneyUtils.toDouble(execution.price());
        double limit = request.getLimitPrice();
        return PostTradeFact.builder()
                .id(execution.brokerOrderId())
                .planId(request.getPlanId())
                .symbol(execution.symbol())
                .side(execution.side())
                .optionType(request.getOptionType())
                .price(price)
                .qty(execution.filledQty())
                .requestedQty(routedQty)
                .fees(MoneyUtils.toDouble(execution.fees()))
                .timestamp(execution.filledAt())
                .netDebit(isBuy(execution.side()) ? price : -price)
                .totalCost(MoneyUtils.toDouble(totalCost))
                .cashBefore(MoneyUtils.toDouble(cashBefore))
                .cashAfter(MoneyUtils.toDouble(cashAfter))
                .actualSlippage(Math.abs(price - limit) / limit)
                .portfolioGreeks(request.getPortfolioGreeks())
                .sides(request.getSides())
                .brokerAttestation(execution.attestation())
                .allocationId(request.getAllocationId())
                .route(request.getRoute())
                .entry(entry)
                .build();
    }

    private static void validate(ExecutionRequest request) {
        if (request == null) {
            throw new BadRequestException("Execution request is required");
        }
        if (request.getQuantity() == null || request.getQuantity() <= 0) {
            throw new BadRequestException("Quantity must be positive");
        }
        if (request.getLimitPrice() == null || !(request.getLimitPrice() > 0)) {
            throw new BadRequestException("Limit price must be positive");
        }
        if (request.getPlannedMaxSlip() == null || !(request.getPlannedMaxSlip() > 0)) {
            throw new BadRequestException("Planned max slippage must be positive");
        }
    }

    /**
     * Opening orders are entries unless the caller says otherwise.
     */
    static boolean isEntry(ExecutionRequest request) {
        if (request.getEntry() != null) {
            return request.getEntry();
        }
        String side = request.getSide() == null ? "" : request.getSide().toUpperCase(Locale.ROOT);
        return side.endsWith("_TO_OPEN") || side.equals("BUY");
    }

    private static boolean isBuy(String side) {
        return side != null && side.toUpperCase().startsWith("BUY");
    }
}
