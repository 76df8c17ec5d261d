package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.dto.ProductionMetrics;
import com.tradeguard.backend.model.LedgerSnapshot;
import com.tradeguard.backend.util.MoneyUtils;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProductionPerformanceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-20T16:00:00Z");

    private final MarketRecorderService recorder = mock(MarketRecorderService.class);
    private final AllocatorProperties properties = new AllocatorProperties();
    private final ProductionPerformanceService service = new ProductionPerformanceService(recorder, properties,
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void dailyEquityKeepsTheLastBalanceOfEachDay() {
        List<Double> equity = ProductionPerformanceService.dailyEquity(List.of(
                ledger("2026-03-02T14:00:00Z", 100_000),
                ledger("2026-03-02T19:00:00Z", 101_000),
                ledger("2026-03-03T15:00:00Z", 99_000)));

        assertThat(equity).containsExactly(101_000.0, 99_000.0);
    }

    @Test
    void maxDrawdownIsPeakToTroughFraction() {
        assertThat(ProductionPerformanceService.maxDrawdown(List.of(100.0, 120.0, 90.0, 130.0, 117.0)))
                .isCloseTo(0.25, within(1e-12));
        assertThat(ProductionPerformanceService.maxDrawdown(List.of(100.0, 101.0, 102.0))).isZero();
    }

    @Test
    void sharpeIsZeroWithoutVariance() {
        assertThat(ProductionPerformanceService.sharpe(List.of(100.0, 101.0))).isZero();
        assertThat(ProductionPerformanceService.sharpe(List.of(100.0, 100.0, 100.0))).isZero();
        assertThat(ProductionPerformanceService.sharpe(List.of(100.0, 102.0, 103.0, 105.0))).isPositive();
    }

    @Test
    void metricsFromRecordedLedger() {
        when(recorder.ledgerChanges(any(), any())).thenReturn(List.of(
                ledger("2026-03-16T20:00:00Z", 100_000),
                ledger("2026-03-17T20:00:00Z", 101_000),
                ledger("2026-03-18T20:00:00Z", 99_990),
                ledger("2026-03-19T20:00:00Z", 102_000)));

        ProductionMetrics metrics = service.currentMetrics();

        assertThat(metrics.available()).isTrue();
        assertThat(metrics.days()).isEqualTo(4);
        assertThat(metrics.equity()).isEqualTo(102_000.0);
        assertThat(metrics.maxDrawdown20d()).isEqualTo(0.01);
    }

    @Test
    void shortHistoryIsUnavailable() {
        when(recorder.ledgerChanges(any(), any())).thenReturn(List.of(ledger("2026-03-19T20:00:00Z", 98_000)));

        ProductionMetrics metrics = service.currentMetrics();

        assertThat(metrics.available()).isFalse();
        assertThat(metrics.sharpe20d()).isZero();
        assertThat(metrics.equity()).isEqualTo(98_000.0);
    }

    @Test
    void readFailureDegradesToFallbackEquity() {
        when(recorder.ledgerChanges(any(), any())).thenThrow(new IllegalStateException("db down"));
        when(recorder.latestLedger()).thenThrow(new IllegalStateException("db down"));

        assertThat(service.currentMetrics().available()).isFalse();
        assertThat(service.currentMetrics().equity()).isEqualTo(properties.getFallbackEquity());
        assertThat(service.currentEquity()).isEqualTo(properties.getFallbackEquity());
    }

    @Test
    void currentEquityUsesLatestLedger() {
        when(recorder.latestLedger()).thenReturn(Optional.of(ledger("2026-03-19T20:00:00Z", 87_500.5)));

        assertThat(service.currentEquity()).isEqualTo(87_500.5);
    }

    private static LedgerSnapshot ledger(String at, double cashAfter) {
        return LedgerSnapshot.builder()
                .cashBefore(MoneyUtils.bd(cashAfter))
                .cashAfter(MoneyUtils.bd(cashAfter))
                .changeReason("test")
                .tsChange(Instant.parse(at))
                .build();
    }
}
