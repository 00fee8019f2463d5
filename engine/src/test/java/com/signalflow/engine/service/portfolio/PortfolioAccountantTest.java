package com.signalflow.engine.service.portfolio;

import com.signalflow.engine.model.PortfolioSnapshot;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.repository.PortfolioSnapshotRepository;
import com.signalflow.engine.repository.TradeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PortfolioAccountantTest {

    private static final Instant NOW = Instant.parse("2024-03-05T20:00:00Z");

    private final TradeRepository tradeRepository = mock(TradeRepository.class);
    private final PortfolioSnapshotRepository snapshotRepository = mock(PortfolioSnapshotRepository.class);
    private final PortfolioStateLoader loader = mock(PortfolioStateLoader.class);
    private final PortfolioAccountant accountant =
            new PortfolioAccountant(tradeRepository, snapshotRepository, loader, Clock.fixed(NOW, ZoneOffset.UTC));

    @BeforeEach
    void setUp() {
        when(snapshotRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
    }

    private Trade open(String symbol, Trade.Side side, double size, double entry) {
        return Trade.builder()
                .exchange(Venue.BINANCE)
                .symbol(symbol)
                .side(side)
                .size(size)
                .entryPrice(entry)
                .status(Trade.TradeStatus.OPEN)
                .build();
    }

    @Test
    void writesPricedPositionsAndTotal() {
        when(loader.loadVenue(Venue.BINANCE)).thenReturn(VenuePortfolio.empty(Venue.BINANCE, 7_000));
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(Venue.BINANCE, Trade.TradeStatus.OPEN))
                .thenReturn(List.of(
                        open("BTCUSDT", Trade.Side.LONG, 0.05, 40_000),
                        open("ETHUSDT", Trade.Side.SHORT, 0.5, 2_000),
                        open("SOLUSDT", Trade.Side.LONG, 10, 100)));

        List<PortfolioSnapshot> rows = accountant.record(Venue.BINANCE, Map.of("BTCUSDT", 42_000.0, "ETHUSDT", 2_100.0));

        assertThat(rows).hasSize(3);
        PortfolioSnapshot btc = rows.get(0);
        assertThat(btc.getSymbol()).isEqualTo("BTCUSDT");
        assertThat(btc.getUnrealizedPnl()).isEqualTo(100.0);
        assertThat(btc.getCurrentPrice()).isEqualTo(42_000.0);
        assertThat(rows.get(1).getUnrealizedPnl()).isEqualTo(-50.0);

        PortfolioSnapshot total = rows.get(2);
        assertThat(total.isTotalRow()).isTrue();
        assertThat(total.getPositionSize()).isEqualTo(3.0);
        assertThat(total.getUnrealizedPnl()).isEqualTo(50.0);
        // cost basis 2000 + 1000 + 1000, plus unrealized
        assertThat(total.getTotalValue()).isEqualTo(4_050.0);
        assertThat(total.getTotalCash()).isEqualTo(7_000.0);
        assertThat(rows).allSatisfy(row -> assertThat(row.getTimestamp()).isEqualTo(NOW));
    }

    @Test
    void emptyVenueGetsZeroedTotal() {
        when(loader.loadVenue(Venue.ALPACA)).thenReturn(VenuePortfolio.empty(Venue.ALPACA, 100_000));
        when(tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(Venue.ALPACA, Trade.TradeStatus.OPEN))
                .thenReturn(List.of());

        List<PortfolioSnapshot> rows = accountant.record(Venue.ALPACA, Map.of());

        assertThat(rows).singleElement().satisfies(total -> {
            assertThat(total.isTotalRow()).isTrue();
            assertThat(total.getPositionSize()).isZero();
            assertThat(total.getUnrealizedPnl()).isZero();
            assertThat(total.getTotalValue()).isZero();
            assertThat(total.getExchange()).isEqualTo(Venue.ALPACA);
        });
    }
}
