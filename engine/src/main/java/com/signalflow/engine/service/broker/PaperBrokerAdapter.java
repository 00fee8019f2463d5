package com.signalflow.engine.service.broker;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.exception.BrokerRejectedException;
import com.signalflow.engine.exception.BrokerUnavailableException;
import com.signalflow.engine.exception.PriceUnavailableException;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.service.marketdata.PriceOracle;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Simulated venue that fills market orders immediately at the oracle price plus
 * adverse slippage.
 */
@Slf4j
public abstract class PaperBrokerAdapter implements BrokerAdapter {

    private final PriceOracle priceOracle;
    private final EngineProperties properties;
    private final Clock clock;

    protected PaperBrokerAdapter(PriceOracle priceOracle, EngineProperties properties, Clock clock) {
        this.priceOracle = priceOracle;
        this.properties = properties;
        this.clock = clock;
    }

    protected abstract String refPrefix();

    protected void validateOrder(String symbol, double size) {
    }

    @Override
    public Fill submitMarketOrder(String symbol, Trade.Side side, double size) {
        EngineProperties.VenueProperties venueProps = properties.venue(venue());
        if (!venueProps.isEnabled()) {
            throw new BrokerRejectedException(venue() + " is disabled");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new BrokerRejectedException("Missing symbol");
        }
        if (!Double.isFinite(size) || size <= 0) {
            throw new BrokerRejectedException("Invalid order size " + size);
        }
        validateOrder(symbol, size);

        double marketPrice;
        try {
            marketPrice = priceOracle.latestPrice(symbol);
        } catch (PriceUnavailableException e) {
            throw new BrokerUnavailableException(venue() + " has no market for " + symbol + ": " + e.getMessage(), e);
        }

        double slippage = venueProps.getSlippageBps() / 10_000.0;
        double fillPrice = side == Trade.Side.LONG ? marketPrice * (1 + slippage) : marketPrice * (1 - slippage);
        double notional = fillPrice * size;
        if (notional < venueProps.getMinNotional()) {
            throw new BrokerRejectedException(String.format("Order notional %.2f below %s minimum %.2f",
                    notional, venue(), venueProps.getMinNotional()));
        }

        Instant filledAt = clock.instant();
        String ref = refPrefix() + "-" + UUID.randomUUID();
        log.info("Paper fill {} {} {} x {} @ {} ref={}", venue(), side, symbol, size, fillPrice, ref);
        return new Fill(fillPrice, ref, filledAt);
    }
}
