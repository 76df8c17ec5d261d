package com.tradeguard.backend.trading.gate;

import com.tradeguard.backend.config.GateProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PreTradeGateTest {

    private final PreTradeGate gate = new PreTradeGate(new GateProperties());

    @Test
    void staleQuoteIsRejectedWithNothingRouted() {
        GateDecision decision = gate.evaluate(healthy().quoteAgeS(15.0).build());

        assertThat(decision.decision()).isEqualTo(GateDecision.Decision.REJECT);
        assertThat(decision.reason()).isEqualTo(GateRejectReason.STALE_DATA);
        assertThat(decision.routedQty()).isZero();
    }

    @Test
    void missingHealthInputsFailClosed() {
        assertThat(gate.evaluate(null).reason()).isEqualTo(GateRejectReason.STALE_DATA);
        assertThat(gate.evaluate(healthy().stale(null).build()).reason()).isEqualTo(GateRejectReason.STALE_DATA);
        assertThat(gate.evaluate(healthy().brokerAgeS(null).build()).reason()).isEqualTo(GateRejectReason.STALE_DATA);
        assertThat(gate.evaluate(healthy().stale(true).build()).reason()).isEqualTo(GateRejectReason.STALE_DATA);
        assertThat(gate.evaluate(healthy().brokerAgeS(31.0).build()).reason()).isEqualTo(GateRejectReason.STALE_DATA);
    }

    @Test
    void exitSkipsHeatAndCashButNotStaleness() {
        GateContext.GateContextBuilder overExposed = healthy()
                .portfolioHeat(0.40)
                .strategyHeat(0.50)
                .availableCash(0.0)
                .ddMult(0.0);

        GateDecision exit = gate.evaluateExit(overExposed.build());
        GateDecision staleExit = gate.evaluateExit(overExposed.stale(true).build());

        assertThat(exit.decision()).isEqualTo(GateDecision.Decision.ACCEPT);
        assertThat(exit.routedQty()).isEqualTo(10.0);
        assertThat(staleExit.reason()).isEqualTo(GateRejectReason.STALE_DATA);
        assertThat(gate.evaluateExit(null).reason()).isEqualTo(GateRejectReason.STALE_DATA);
        assertThat(gate.evaluateExit(healthy().requestedQty(0.0).build()).reason())
                .isEqualTo(GateRejectReason.SIZE_ZERO);
    }

    @Test
    void checksRunInOrder() {
        GateDecision decision = gate.evaluate(healthy()
                .portfolioHeat(0.30)
                .strategyHeat(0.50)
                .availableCash(1.0)
                .build());

        assertThat(decision.reason()).isEqualTo(GateRejectReason.PORTFOLIO_HEAT);
        assertThat(gate.evaluate(healthy().strategyHeat(0.10).build()).reason())
                .isEqualTo(GateRejectReason.STRATEGY_HEAT);
        assertThat(gate.evaluate(healthy().strategyHeat(null).build()).reason())
                .isEqualTo(GateRejectReason.STRATEGY_HEAT);
    }

    @Test
    void notionalAboveCashIsRejected() {
        GateDecision decision = gate.evaluate(healthy().requestedQty(100.0).price(50.0).availableCash(4_999.0).build());

        assertThat(decision.reason()).isEqualTo(GateRejectReason.INSUFFICIENT_CASH);
        assertThat(gate.evaluate(healthy().price(null).build()).reason()).isEqualTo(GateRejectReason.INSUFFICIENT_CASH);
    }

    @Test
    void drawdownMultiplierScalesRoutedSizeButNeverAboveRequested() {
        GateDecision scaled = gate.evaluate(healthy().requestedQty(10.0).ddMult(0.5).build());
        GateDecision capped = gate.evaluate(healthy().requestedQty(10.0).ddMult(1.8).build());

        assertThat(scaled.accepted()).isTrue();
        assertThat(scaled.routedQty()).isEqualTo(5.0);
        assertThat(capped.accepted()).isTrue();
        assertThat(capped.routedQty()).isEqualTo(10.0);
    }

    @Test
    void zeroRoutedSizeIsRejected() {
        assertThat(gate.evaluate(healthy().ddMult(0.0).build()).reason()).isEqualTo(GateRejectReason.SIZE_ZERO);
        assertThat(gate.evaluate(healthy().requestedQty(0.0).build()).reason()).isEqualTo(GateRejectReason.SIZE_ZERO);
        assertThat(gate.evaluate(healthy().ddMult(null).build()).reason()).isEqualTo(GateRejectReason.SIZE_ZERO);
    }

    @Test
    void everyDecisionIsExactlyAcceptWithSizeOrRejectWithout() {
        double[] quantities = {0.0, 1.0, 7.5, 250.0};
        double[] multipliers = {0.0, 0.25, 1.0, 3.0};
        double[] heats = {0.0, 0.2, 0.3};
        for (double qty : quantities) {
            for (double mult : multipliers) {
                for (double heat : heats) {
                    GateDecision decision = gate.evaluate(healthy()
                            .requestedQty(qty).ddMult(mult).portfolioHeat(heat).build());
                    assertThat(decision.routedQty()).isLessThanOrEqualTo(qty);
                    if (decision.accepted()) {
                        assertThat(decision.routedQty()).isPositive();
                        assertThat(decision.reason()).isNull();
                    } else {
                        assertThat(decision.routedQty()).isZero();
                        assertThat(decision.reason()).isNotNull();
                    }
                }
            }
        }
    }

    private static GateContext.GateContextBuilder healthy() {
        return GateContext.builder()
                .symbol("AAPL")
                .strategyId("stratA")
                .nav(100_000.0)
                .portfolioHeat(0.05)
                .strategyHeat(0.02)
                .ddMult(1.0)
                .requestedQty(10.0)
                .price(100.0)
                .availableCash(50_000.0)
                .quoteAgeS(1.0)
                .brokerAgeS(2.0)
                .stale(false);
    }
}
