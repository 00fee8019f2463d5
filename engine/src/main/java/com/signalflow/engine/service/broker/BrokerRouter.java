package com.signalflow.engine.service.broker;

import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class BrokerRouter {

    private final Map<Venue, BrokerAdapter> adapters = new EnumMap<>(Venue.class);
    private final Retry brokerRetry;

    public BrokerRouter(List<BrokerAdapter> brokerAdapters, @Qualifier("brokerRetry") Retry brokerRetry) {
        for (BrokerAdapter adapter : brokerAdapters) {
            BrokerAdapter previous = adapters.put(adapter.venue(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two broker adapters registered for " + adapter.venue());
            }
        }
        for (Venue venue : Venue.values()) {
            if (!adapters.containsKey(venue)) {
                throw new IllegalStateException("No broker adapter registered for " + venue);
            }
        }
        this.brokerRetry = brokerRetry;
        log.info("Broker adapters registered for {}", adapters.keySet());
    }

    public BrokerAdapter adapterFor(Venue venue) {
        return adapters.get(venue);
    }

    /**
     * Submits through the venue's adapter, retrying transient unavailability only.
     */
    public Fill submit(Venue venue, String symbol, Trade.Side side, double size) {
        BrokerAdapter adapter = adapterFor(venue);
        return Retry.decorateSupplier(brokerRetry, () -> adapter.submitMarketOrder(symbol, side, size)).get();
    }
}
