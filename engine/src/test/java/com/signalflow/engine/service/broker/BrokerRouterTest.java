package com.signalflow.engine.service.broker;

import com.signalflow.engine.exception.BrokerRejectedException;
import com.signalflow.engine.exception.BrokerUnavailableException;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrokerRouterTest {

    private final Retry retry = Retry.of("broker-test", RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(1))
            .retryExceptions(BrokerUnavailableException.class)
            .build());

    private BrokerAdapter adapter(Venue venue) {
        BrokerAdapter adapter = mock(BrokerAdapter.class);
        when(adapter.venue()).thenReturn(venue);
        return adapter;
    }

    @Test
    void routesToVenueAdapter() {
        BrokerAdapter equity = adapter(Venue.ALPACA);
        BrokerAdapter crypto = adapter(Venue.BINANCE);
        Fill fill = new Fill(101.0, "BIN-1", Instant.EPOCH);
        when(crypto.submitMarketOrder("BTCUSDT", Trade.Side.LONG, 1.0)).thenReturn(fill);

        BrokerRouter router = new BrokerRouter(List.of(equity, crypto), retry);

        assertThat(router.submit(Venue.BINANCE, "BTCUSDT", Trade.Side.LONG, 1.0)).isEqualTo(fill);
        assertThat(router.adapterFor(Venue.ALPACA)).isSameAs(equity);
    }

    @Test
    void retriesTransientUnavailability() {
        BrokerAdapter equity = adapter(Venue.ALPACA);
        Fill fill = new Fill(100.0, "ALP-1", Instant.EPOCH);
        when(equity.submitMarketOrder("AAPL", Trade.Side.LONG, 2.0))
                .thenThrow(new BrokerUnavailableException("busy"))
                .thenReturn(fill);
        BrokerRouter router = new BrokerRouter(List.of(equity, adapter(Venue.BINANCE)), retry);

        assertThat(router.submit(Venue.ALPACA, "AAPL", Trade.Side.LONG, 2.0)).isEqualTo(fill);
        verify(equity, times(2)).submitMarketOrder("AAPL", Trade.Side.LONG, 2.0);
    }

    @Test
    void definitiveRejectionIsNotRetried() {
        BrokerAdapter equity = adapter(Venue.ALPACA);
        when(equity.submitMarketOrder("AAPL", Trade.Side.LONG, 2.0)).thenThrow(new BrokerRejectedException("bad order"));
        BrokerRouter router = new BrokerRouter(List.of(equity, adapter(Venue.BINANCE)), retry);

        assertThatThrownBy(() -> router.submit(Venue.ALPACA, "AAPL", Trade.Side.LONG, 2.0))
                .isInstanceOf(BrokerRejectedException.class);
        verify(equity, times(1)).submitMarketOrder("AAPL", Trade.Side.LONG, 2.0);
    }

    @Test
    void everyVenueNeedsExactlyOneAdapter() {
        assertThatThrownBy(() -> new BrokerRouter(List.of(adapter(Venue.ALPACA)), retry))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new BrokerRouter(
                List.of(adapter(Venue.ALPACA), adapter(Venue.ALPACA), adapter(Venue.BINANCE)), retry))
                .isInstanceOf(IllegalStateException.class);
    }
}
