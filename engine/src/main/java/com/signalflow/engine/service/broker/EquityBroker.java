package com.signalflow.engine.service.broker;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.exception.BrokerRejectedException;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.service.marketdata.PriceOracle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.regex.Pattern;

@Service
public class EquityBroker extends PaperBrokerAdapter {

    private static final Pattern TICKER = Pattern.compile("^[A-Z][A-Z0-9.\\-]{0,9}$");

    public EquityBroker(PriceOracle priceOracle, EngineProperties properties, Clock clock) {
        super(priceOracle, properties, clock);
    }

    @Override
    public Venue venue() {
        return Venue.ALPACA;
    }

    @Override
    protected String refPrefix() {
        return "ALP";
    }

    @Override
    protected void validateOrder(String symbol, double size) {
        if (!TICKER.matcher(symbol).matches()) {
            throw new BrokerRejectedException("Not an equity ticker: " + symbol);
        }
    }
}
