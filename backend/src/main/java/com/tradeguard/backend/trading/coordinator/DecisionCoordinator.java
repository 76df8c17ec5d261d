package com.tradeguard.backend.trading.coordinator;

import com.tradeguard.backend.config.CoordinatorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scores competing signals and keeps exactly one per symbol.
 * <p>
 * Equal scores are broken by strategy id, then side, then intake order, so the
 * outcome never depends on hash or arrival ordering of the stats map.
 */
@Slf4j
@Component
public class DecisionCoordinator {

    public static final String WINNER_REASON = "coordinator_winner";
    public static final String LOWER_SCORE = "lower_score";

    static final Comparator<ScoredSignal> RANKING = Comparator
            .comparingDouble(ScoredSignal::score).reversed()
            .thenComparing(scored -> scored.signal().strategyId())
            .thenComparing(scored -> scored.signal().side().name())
            .thenComparingInt(ScoredSignal::intakeOrder);

    private final CoordinatorProperties properties;
    private final Clock clock;
    private final AtomicReference<CycleAudit> lastCycle = new AtomicReference<>();
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong signalsScored = new AtomicLong();
    private final AtomicLong winnersSelected = new AtomicLong();
    private final AtomicLong conflictsResolved = new AtomicLong();

    public DecisionCoordinator(CoordinatorProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public List<WinningIntent> pickWinningIntents(List<TradingSignal> signals, Map<String, StrategyStats> stats) {
        List<TradingSignal> input = signals == null ? List.of() : signals;
        Map<String, StrategyStats> snapshot = stats == null ? Map.of() : Map.copyOf(stats);

        Map<String, List<ScoredSignal>> bySymbol = new LinkedHashMap<>();
        for (int i = 0; i < input.size(); i++) {
            TradingSignal signal = input.get(i);
            ScoredSignal scored = score(signal, i, snapshot.getOrDefault(signal.strategyId(), StrategyStats.DEFAULT));
            bySymbol.computeIfAbsent(signal.symbol(), key -> new ArrayList<>()).add(scored);
        }

        List<WinningIntent> winners = new ArrayList<>();
        List<CycleAudit.Conflict> conflicts = new ArrayList<>();
        int rejects = 0;
        for (Map.Entry<String, List<ScoredSignal>> entry : bySymbol.entrySet()) {
            List<ScoredSignal> ranked = new ArrayList<>(entry.getValue());
            ranked.sort(RANKING);
            ScoredSignal winner = ranked.get(0);
            List<WinningIntent.Contender> losers = ranked.stream()
                    .skip(1)
                    .map(loser -> loser.rejected(LOWER_SCORE))
                    .map(loser -> new WinningIntent.Contender(loser.signal().strategyId(), loser.signal().side(),
                            loser.score(), loser.rejectionReason()))
                    .toList();
            List<WinningIntent.Contender> contenders = losers.stream()
                    .limit(properties.getMaxContenders())
                    .toList();
            rejects += losers.size();
            winners.add(toIntent(winner, contenders, losers));
            if (ranked.size() > 1) {
                conflicts.add(new CycleAudit.Conflict(entry.getKey(), winner.signal().strategyId(), winner.score(),
                        contenders));
            }
        }

        Instant now = clock.instant();
        lastCycle.set(new CycleAudit(now, input.size(), input.size(), winners.size(), rejects,
                List.copyOf(conflicts), List.copyOf(winners)));
        cycles.incrementAndGet();
        signalsScored.addAndGet(input.size());
        winnersSelected.addAndGet(winners.size());
        conflictsResolved.addAndGet(conflicts.size());
        log.debug("Coordinator cycle: signals={} winners={} conflicts={}", input.size(), winners.size(), conflicts.size());
        return List.copyOf(winners);
    }

    public ScoredSignal score(TradingSignal signal, int intakeOrder, StrategyStats stats) {
        int cappedTrades = Math.min(stats.tradesCount(), properties.getTradesCap());
        double reliability = clamp(stats.profitFactor() * (1 + cappedTrades / 1000.0),
                properties.getMinReliability(), properties.getMaxReliability());
        double liquidity = clamp(1 - signal.spreadBps() / 10000.0,
                properties.getMinLiquidity(), properties.getMaxLiquidity());
        double pWin = stats.winRate();
        double afterCostEv = pWin * stats.avgWin() - (1 - pWin) * stats.avgLoss() - signal.costsEst();
        double score = afterCostEv * reliability * liquidity * signal.confidence();
        ScoreBreakdown breakdown = new ScoreBreakdown(stats.profitFactor(), stats.tradesCount(), pWin,
                stats.avgWin(), stats.avgLoss(), signal.costsEst(), signal.spreadBps(), signal.confidence());
        return new ScoredSignal(signal, intakeOrder, reliability, liquidity, afterCostEv, score, breakdown, null);
    }

    public Optional<CycleAudit> getLastCycleAudit() {
        return Optional.ofNullable(lastCycle.get());
    }

    public CoordinatorStats getStats() {
        return new CoordinatorStats(cycles.get(), signalsScored.get(), winnersSelected.get(), conflictsResolved.get());
    }

    private WinningIntent toIntent(ScoredSignal winner, List<WinningIntent.Contender> contenders,
                                   List<WinningIntent.Contender> losers) {
        WinningIntent.Meta meta = new WinningIntent.Meta(
                WINNER_REASON,
                winner.score(),
                contenders,
                winner.afterCostEv(),
                winner.reliability(),
                winner.liquidity(),
                winner.signal().confidence(),
                winner.breakdown()
        );
        return new WinningIntent(winner.signal().intentKey(), winner.signal(), meta, losers);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
