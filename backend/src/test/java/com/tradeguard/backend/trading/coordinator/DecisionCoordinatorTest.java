package com.tradeguard.backend.trading.coordinator;

import com.tradeguard.backend.config.CoordinatorProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DecisionCoordinatorTest {

    private final DecisionCoordinator coordinator = new DecisionCoordinator(new CoordinatorProperties(),
            Clock.fixed(Instant.parse("2026-03-02T14:00:00Z"), ZoneOffset.UTC));

    @Test
    void higherAfterCostEvWinsTheSymbol() {
        List<TradingSignal> signals = List.of(
                signal("AAPL", Side.BUY, "stratA", 0.1),
                signal("AAPL", Side.BUY, "stratB", 0.1));
        Map<String, StrategyStats> stats = Map.of(
                "stratA", new StrategyStats(1.5, 100, 0.6, 2.0, 1.0),
                "stratB", new StrategyStats(1.5, 100, 0.5, 1.0, 1.0));

        List<WinningIntent> winners = coordinator.pickWinningIntents(signals, stats);

        assertThat(winners).hasSize(1);
        WinningIntent winner = winners.get(0);
        assertThat(winner.signal().strategyId()).isEqualTo("stratA");
        assertThat(winner.meta().reason()).isEqualTo(DecisionCoordinator.WINNER_REASON);
        assertThat(winner.meta().afterCostEv()).isCloseTo(0.7, within(1e-9));
        assertThat(winner.meta().contenders()).singleElement()
                .satisfies(contender -> {
                    assertThat(contender.strategyId()).isEqualTo("stratB");
                    assertThat(contender.rejectionReason()).isEqualTo(DecisionCoordinator.LOWER_SCORE);
                    assertThat(contender.score()).isLessThanOrEqualTo(winner.meta().score());
                });
    }

    @Test
    void oneWinnerPerSymbolWithTheTopScore() {
        List<TradingSignal> signals = new ArrayList<>();
        signals.add(signal("AAPL", Side.BUY, "s1", 0.0));
        signals.add(signal("MSFT", Side.SELL, "s2", 0.0));
        signals.add(signal("AAPL", Side.SELL, "s3", 0.5));
        signals.add(signal("MSFT", Side.BUY, "s1", 0.2));
        signals.add(signal("TSLA", Side.BUY, "s2", 0.0));
        Map<String, StrategyStats> stats = Map.of(
                "s1", new StrategyStats(1.2, 40, 0.55, 1.5, 1.0),
                "s2", new StrategyStats(0.9, 10, 0.45, 1.0, 1.0),
                "s3", new StrategyStats(2.0, 300, 0.65, 2.5, 1.0));

        List<WinningIntent> winners = coordinator.pickWinningIntents(signals, stats);

        assertThat(winners).extracting(intent -> intent.signal().symbol())
                .containsExactly("AAPL", "MSFT", "TSLA");
        for (WinningIntent winner : winners) {
            String symbol = winner.signal().symbol();
            for (TradingSignal other : signals) {
                if (other.symbol().equals(symbol)) {
                    double otherScore = coordinator.score(other, 0,
                            stats.getOrDefault(other.strategyId(), StrategyStats.DEFAULT)).score();
                    assertThat(winner.meta().score()).isGreaterThanOrEqualTo(otherScore);
                }
            }
        }
    }

    @Test
    void exactTieFallsBackToStrategyIdThenSide() {
        StrategyStats same = new StrategyStats(1.0, 0, 0.6, 2.0, 1.0);
        List<TradingSignal> signals = List.of(
                signal("SPY", Side.SELL, "zeta", 0.0),
                signal("SPY", Side.SELL, "alpha", 0.0),
                signal("SPY", Side.BUY, "alpha", 0.0));

        List<WinningIntent> first = coordinator.pickWinningIntents(signals, Map.of("zeta", same, "alpha", same));
        List<WinningIntent> reversed = coordinator.pickWinningIntents(
                List.of(signals.get(2), signals.get(1), signals.get(0)), Map.of("alpha", same, "zeta", same));

        assertThat(first.get(0).key()).isEqualTo("SPY:BUY:alpha");
        assertThat(reversed.get(0).key()).isEqualTo(first.get(0).key());
    }

    @Test
    void unknownStrategyUsesDefaultStatsAndCycleAuditIsKept() {
        List<WinningIntent> winners = coordinator.pickWinningIntents(
                List.of(signal("qqq", Side.BUY, "fresh", 0.0)), Map.of());

        assertThat(winners).singleElement().satisfies(intent -> {
            assertThat(intent.signal().symbol()).isEqualTo("QQQ");
            assertThat(intent.meta().reliability()).isEqualTo(1.0);
        });
        assertThat(coordinator.getLastCycleAudit()).hasValueSatisfying(audit -> {
            assertThat(audit.winners()).isEqualTo(1);
            assertThat(audit.conflicts()).isEmpty();
        });
        assertThat(coordinator.getStats().cycles()).isEqualTo(1);
    }

    @Test
    void everyLoserIsMarkedButOnlyTopContendersAreKept() {
        CoordinatorProperties properties = new CoordinatorProperties();
        properties.setMaxContenders(2);
        DecisionCoordinator capped = new DecisionCoordinator(properties,
                Clock.fixed(Instant.parse("2026-03-02T14:00:00Z"), ZoneOffset.UTC));
        List<TradingSignal> signals = List.of(
                signal("SPY", Side.BUY, "s1", 0.0),
                signal("SPY", Side.BUY, "s2", 0.1),
                signal("SPY", Side.BUY, "s3", 0.2),
                signal("SPY", Side.BUY, "s4", 0.3),
                signal("SPY", Side.BUY, "s5", 0.4));

        WinningIntent winner = capped.pickWinningIntents(signals, Map.of()).get(0);

        assertThat(winner.signal().strategyId()).isEqualTo("s1");
        assertThat(winner.losers()).extracting(WinningIntent.Contender::strategyId)
                .containsExactly("s2", "s3", "s4", "s5");
        assertThat(winner.losers()).extracting(WinningIntent.Contender::rejectionReason)
                .containsOnly(DecisionCoordinator.LOWER_SCORE);
        assertThat(winner.meta().contenders()).extracting(WinningIntent.Contender::strategyId)
                .containsExactly("s2", "s3");
        assertThat(capped.getLastCycleAudit()).hasValueSatisfying(audit ->
                assertThat(audit.conflicts()).singleElement()
                        .satisfies(conflict -> assertThat(conflict.contenders()).hasSize(2)));
    }

    @Test
    void emptyInputYieldsNoWinners() {
        assertThat(coordinator.pickWinningIntents(List.of(), Map.of())).isEmpty();
        assertThat(coordinator.pickWinningIntents(null, null)).isEmpty();
    }

    private static TradingSignal signal(String symbol, Side side, String strategyId, double costs) {
        return TradingSignal.of(symbol, side, strategyId, 1.0, 100.0, 5.0, costs, 10.0);
    }
}
