package com.signalflow.engine.service.broker;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.service.marketdata.PriceOracle;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class CryptoBroker extends PaperBrokerAdapter {

    public CryptoBroker(PriceOracle priceOracle, EngineProperties properties, Clock clock) {
        super(priceOracle, properties, clock);
    }

    @Override
    public Venue venue() {
        return Venue.BINANCE;
    }

    @Override
    protected String refPrefix() {
        return "BIN";
    }
}
