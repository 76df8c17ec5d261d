package com.tradeguard.backend.service;

import com.tradeguard.backend.dto.CycleRequest;
import com.tradeguard.backend.dto.CycleResult;
import com.tradeguard.backend.dto.PortfolioState;
import com.tradeguard.backend.dto.SignalInput;
import com.tradeguard.backend.dto.StrategyStatsInput;
import com.tradeguard.backend.exception.BadRequestException;
import com.tradeguard.backend.service.marketdata.HealthSnapshot;
import com.tradeguard.backend.trading.coordinator.DecisionCoordinator;
import com.tradeguard.backend.trading.coordinator.StrategyStats;
import com.tradeguard.backend.trading.coordinator.TradingSignal;
import com.tradeguard.backend.trading.coordinator.WinningIntent;
import com.tradeguard.backend.trading.gate.GateContext;
import com.tradeguard.backend.trading.gate.GateDecision;
import com.tradeguard.backend.trading.gate.PreTradeGate;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One coordination cycle: validate signals, pick a winner per symbol against a
 * frozen stats snapshot, then run every winner through the gate with the same
 * health snapshot. Each outcome leaves a decision audit row.
 */
@Slf4j
@Service
public class TradingCycleService {

    private final DecisionCoordinator coordinator;
    private final PreTradeGate gate;
    private final MarketHealthService marketHealthService;
    private final DecisionAuditService decisionAuditService;
    private final MetricsService metricsService;
    private final Executor tradingExecutor;
    private final Clock clock;
    private final AtomicReference<CycleResult> lastResult = new AtomicReference<>();

    public TradingCycleService(DecisionCoordinator coordinator, PreTradeGate gate,
                               MarketHealthService marketHealthService, DecisionAuditService decisionAuditService,
                               MetricsService metricsService, @Qualifier("tradingExecutor") Executor tradingExecutor,
                               Clock clock) {
        this.coordinator = coordinator;
        this.gate = gate;
        this.marketHealthService = marketHealthService;
        this.decisionAuditService = decisionAuditService;
        this.metricsService = metricsService;
        this.tradingExecutor = tradingExecutor;
        this.clock = clock;
    }

    public CompletableFuture<CycleResult> submitCycle(CycleRequest request) {
        return CompletableFuture.supplyAsync(() -> runCycle(request), tradingExecutor);
    }

    public CycleResult runCycle(CycleRequest request) {
        String cycleId = "cycle-" + UUID.randomUUID();
        String previousCorrelation = MDC.get("correlationId");
        MDC.put("correlationId", cycleId);
        try {
            List<TradingSignal> signals = intake(request);
            Map<String, StrategyStats> stats = statsSnapshot(request.getStats());
            List<WinningIntent> intents = coordinator.pickWinningIntents(signals, stats);
            HealthSnapshot health = marketHealthService.snapshot();
            PortfolioState portfolio = request.getPortfolio();

            List<CycleResult.GateOutcome> outcomes = new ArrayList<>();
            for (WinningIntent intent : intents) {
                auditWinner(cycleId, intent);
                GateContext context = gateContext(intent.signal().symbol(), intent.signal().strategyId(),
                        intent.signal().quantity(), intent.signal().price(), portfolio, health);
                GateDecision decision = gate.evaluate(context);
                metricsService.recordGateDecision(decision.decision().name(),
                        decision.reason() == null ? null : decision.reason().name());
                auditGate(cycleId, intent, decision);
                outcomes.add(new CycleResult.GateOutcome(intent.key(), intent.signal().symbol(),
                        intent.signal().strategyId(), intent.signal().quantity(), decision));
            }
            CycleResult result = new CycleResult(cycleId, clock.instant(), intents, List.copyOf(outcomes));
            lastResult.set(result);
            log.info("Cycle {} complete: signals={} winners={} accepted={}", cycleId, signals.size(), intents.size(),
                    result.accepted().size());
            return result;
        } finally {
            if (previousCorrelation != null) {
                MDC.put("correlationId", previousCorrelation);
            } else {
                MDC.remove("correlationId");
            }
        }
    }

    public Optional<CycleResult> lastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    private List<TradingSignal> intake(CycleRequest request) {
        if (request == null || request.getSignals() == null) {
            throw new BadRequestException("Cycle request needs a signal list");
        }
        List<TradingSignal> signals = new ArrayList<>();
        for (SignalInput input : request.getSignals()) {
            try {
                signals.add(TradingSignal.of(input.getSymbol(), input.getSide(), input.getStrategyId(),
                        input.getConfidence(), input.getPrice(), input.getSpreadBps(), input.getCostsEst(),
                        input.getQuantity()));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new BadRequestException("Invalid signal " + input.getSymbol() + "/" + input.getStrategyId()
                        + ": " + e.getMessage());
            }
        }
        return signals;
    }

    private static Map<String, StrategyStats> statsSnapshot(Map<String, StrategyStatsInput> inputs) {
        if (inputs == null) {
            return Map.of();
        }
        Map<String, StrategyStats> stats = new HashMap<>();
        inputs.forEach((strategyId, input) -> {
            try {
                stats.put(strategyId, new StrategyStats(input.getProfitFactor(), input.getTradesCount(),
                        input.getWinRate(), input.getAvgWin(), input.getAvgLoss()));
            } catch (IllegalArgumentException e) {
                throw new BadRequestException("Invalid stats for " + strategyId + ": " + e.getMessage());
            }
        });
        return Map.copyOf(stats);
    }

    static GateContext gateContext(String symbol, String strategyId, Double quantity, Double price,
                                   PortfolioState portfolio, HealthSnapshot health) {
        PortfolioState state = portfolio != null ? portfolio : new PortfolioState();
        Map<String, Double> strategyHeat = state.getStrategyHeat() != null ? state.getStrategyHeat() : Map.of();
        return GateContext.builder()
                .symbol(symbol)
                .strategyId(strategyId)
                .nav(state.getNav())
                .portfolioHeat(state.getPortfolioHeat())
                .strategyHeat(strategyId == null ? null : strategyHeat.get(strategyId))
                .ddMult(state.getDdMult())
                .requestedQty(quantity)
                .price(price)
                .availableCash(state.getAvailableCash())
                .quoteAgeS(health.quoteAgeS())
                .brokerAgeS(health.brokerAgeS())
                .stale(health.stale())
                .build();
    }

    private void auditWinner(String cycleId, WinningIntent intent) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("score", intent.meta().score());
        details.put("afterCostEv", intent.meta().afterCostEv());
        details.put("reliability", intent.meta().reliability());
        details.put("liquidity", intent.meta().liquidity());
        details.put("losers", intent.losers().size());
        decisionAuditService.record(cycleId, intent.signal().symbol(), intent.signal().strategyId(),
                DecisionAuditService.WINNER, intent.meta().reason(), details);
        for (WinningIntent.Contender contender : intent.losers()) {
            decisionAuditService.record(cycleId, intent.signal().symbol(), contender.strategyId(),
                    DecisionAuditService.LOSER, contender.rejectionReason(),
                    Map.of("score", contender.score(), "side", contender.side().name()));
        }
    }

    private void auditGate(String cycleId, WinningIntent intent, GateDecision decision) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", decision.message());
        details.put("routedQty", decision.routedQty());
        details.put("requestedQty", intent.signal().quantity());
        decisionAuditService.record(cycleId, intent.signal().symbol(), intent.signal().strategyId(),
                decision.accepted() ? DecisionAuditService.GATE_ACCEPT : DecisionAuditService.GATE_REJECT,
                decision.reason() == null ? null : decision.reason().name(), details);
    }
}
