package com.signalflow.engine.service.exit;

import com.signalflow.engine.dto.CycleOutcome;
import com.signalflow.engine.dto.CycleReport;
import com.signalflow.engine.exception.PersistenceUnavailableException;
import com.signalflow.engine.exception.PriceUnavailableException;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.repository.TradeRepository;
import com.signalflow.engine.service.marketdata.PriceOracle;
import com.signalflow.engine.service.metrics.EngineMetrics;
import com.signalflow.engine.service.metrics.MetricsCalculator;
import com.signalflow.engine.service.portfolio.PortfolioAccountant;
import com.signalflow.engine.service.scheduling.Stage;
import com.signalflow.engine.service.scheduling.StageLockRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExitMonitorTest {

    private static final Instant NOW = Instant.parse("2024-03-05T20:00:00Z");

    private final TradeRepository tradeRepository = mock(TradeRepository.class);
    private final PriceOracle priceOracle = mock(PriceOracle.class);
    private final TradeCloseService tradeCloseService = mock(TradeCloseService.class);
    private final PortfolioAccountant accountant = mock(PortfolioAccountant.class);
    private final MetricsCalculator metricsCalculator = mock(MetricsCalculator.class);
    private final StageLockRegistry stageLocks = new StageLockRegistry();

    private ExitMonitor monitor;

    @BeforeEach
    void setUp() {
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(any(), eq(Trade.TradeStatus.OPEN)))
                .thenReturn(List.of());
        when(tradeCloseService.close(any(), anyDouble(), any())).thenReturn(true);
        monitor = new ExitMonitor(tradeRepository, priceOracle, new ExitEvaluator(), tradeCloseService,
                accountant, metricsCalculator, stageLocks, new EngineMetrics(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Trade open(long id, String symbol, Trade.Side side, double stop, double target) {
        return Trade.builder()
                .id(id)
                .exchange(Venue.ALPACA)
                .symbol(symbol)
                .side(side)
                .entryPrice(100.0)
                .size(10.0)
                .stopLoss(stop)
                .takeProfit(target)
                .entryTime(NOW.minusSeconds(7200))
                .status(Trade.TradeStatus.OPEN)
                .build();
    }

    @Test
    void closesTradesPastTheirLevelsAndSnapshotsTheRest() {
        Trade stopped = open(1, "AAPL", Trade.Side.LONG, 98, 106);
        Trade target = open(2, "MSFT", Trade.Side.LONG, 98, 106);
        Trade holding = open(3, "NVDA", Trade.Side.LONG, 98, 106);
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(Venue.ALPACA, Trade.TradeStatus.OPEN))
                .thenReturn(List.of(stopped, target, holding));
        when(priceOracle.latestPrice("AAPL")).thenReturn(97.5);
        when(priceOracle.latestPrice("MSFT")).thenReturn(107.0);
        when(priceOracle.latestPrice("NVDA")).thenReturn(101.0);

        CycleReport report = monitor.runExitCycle();

        assertThat(report.count(CycleOutcome.CLOSED)).isEqualTo(2);
        assertThat(report.count(CycleOutcome.STILL_OPEN)).isEqualTo(1);
        verify(tradeCloseService).close(stopped, 97.5, Trade.ExitReason.STOP_LOSS);
        verify(tradeCloseService).close(target, 107.0, Trade.ExitReason.TAKE_PROFIT);
        verify(accountant).record(Venue.ALPACA, Map.of("NVDA", 101.0));
        verify(accountant).record(Venue.BINANCE, Map.of());
        verify(metricsCalculator).calculate();
    }

    @Test
    void missingPriceSkipsOnlyThatTrade() {
        Trade unpriced = open(1, "AAPL", Trade.Side.LONG, 98, 106);
        Trade stopped = open(2, "MSFT", Trade.Side.SHORT, 102, 94);
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(Venue.ALPACA, Trade.TradeStatus.OPEN))
                .thenReturn(List.of(unpriced, stopped));
        when(priceOracle.latestPrice("AAPL")).thenThrow(new PriceUnavailableException("AAPL", "timeout"));
        when(priceOracle.latestPrice("MSFT")).thenReturn(103.0);

        CycleReport report = monitor.runExitCycle();

        assertThat(report.count(CycleOutcome.SKIPPED)).isEqualTo(1);
        assertThat(report.count(CycleOutcome.CLOSED)).isEqualTo(1);
        verify(tradeCloseService).close(stopped, 103.0, Trade.ExitReason.STOP_LOSS);
        verify(tradeCloseService, never()).close(eq(unpriced), anyDouble(), any());
    }

    @Test
    void unexpectedOracleErrorSkipsOnlyThatTrade() {
        Trade broken = open(1, "AAPL", Trade.Side.LONG, 98, 106);
        Trade stopped = open(2, "MSFT", Trade.Side.LONG, 98, 106);
        Trade holding = open(3, "NVDA", Trade.Side.LONG, 98, 106);
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(Venue.ALPACA, Trade.TradeStatus.OPEN))
                .thenReturn(List.of(broken, stopped, holding));
        when(priceOracle.latestPrice("AAPL"))
                .thenThrow(new RestClientException("Error while extracting response for type [QuoteResponse]"));
        when(priceOracle.latestPrice("MSFT")).thenReturn(97.5);
        when(priceOracle.latestPrice("NVDA")).thenReturn(101.0);

        CycleReport report = monitor.runExitCycle();

        assertThat(report.count(CycleOutcome.SKIPPED)).isEqualTo(1);
        assertThat(report.count(CycleOutcome.CLOSED)).isEqualTo(1);
        assertThat(report.count(CycleOutcome.STILL_OPEN)).isEqualTo(1);
        verify(tradeCloseService).close(stopped, 97.5, Trade.ExitReason.STOP_LOSS);
        verify(accountant).record(Venue.ALPACA, Map.of("NVDA", 101.0));
        verify(metricsCalculator).calculate();
    }

    @Test
    void storeOutageWhileClosingAbortsCycle() {
        Trade stopped = open(1, "AAPL", Trade.Side.LONG, 98, 106);
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(Venue.ALPACA, Trade.TradeStatus.OPEN))
                .thenReturn(List.of(stopped));
        when(priceOracle.latestPrice("AAPL")).thenReturn(90.0);
        when(tradeCloseService.close(any(), anyDouble(), any())).thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> monitor.runExitCycle()).isInstanceOf(PersistenceUnavailableException.class);
        verify(metricsCalculator, never()).calculate();
    }

    @Test
    void tradeClosedElsewhereCountsAsSkipped() {
        Trade stopped = open(1, "AAPL", Trade.Side.LONG, 98, 106);
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(Venue.ALPACA, Trade.TradeStatus.OPEN))
                .thenReturn(List.of(stopped));
        when(priceOracle.latestPrice("AAPL")).thenReturn(90.0);
        when(tradeCloseService.close(any(), anyDouble(), any())).thenReturn(false);

        CycleReport report = monitor.runExitCycle();

        assertThat(report.count(CycleOutcome.SKIPPED)).isEqualTo(1);
        assertThat(report.count(CycleOutcome.CLOSED)).isZero();
    }

    @Test
    void busyVenueIsCoalesced() {
        CycleReport report;
        try (StageLockRegistry.StageLock held = stageLocks.tryAcquire(Stage.EXIT, Venue.BINANCE).orElseThrow()) {
            report = monitor.runExitCycle();
        }

        assertThat(report.coalescedVenues()).containsExactly(Venue.BINANCE);
        verify(tradeRepository, never()).findByExchangeAndStatusOrderByEntryTimeAsc(Venue.BINANCE, Trade.TradeStatus.OPEN);
        verify(accountant).record(Venue.ALPACA, Map.of());
    }

    @Test
    void storeOutageAbortsCycle() {
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(Venue.ALPACA, Trade.TradeStatus.OPEN))
                .thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> monitor.runExitCycle()).isInstanceOf(PersistenceUnavailableException.class);
        verify(metricsCalculator, never()).calculate();
        assertThat(stageLocks.isHeld(Stage.EXIT, Venue.ALPACA)).isFalse();
    }

    @Test
    void manualCloseDelegates() {
        when(tradeCloseService.closeManually(5L, 99.0)).thenReturn(true);

        assertThat(monitor.closeManually(5L, 99.0)).isTrue();
    }
}
