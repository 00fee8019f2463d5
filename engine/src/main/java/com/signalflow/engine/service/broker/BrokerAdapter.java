package com.signalflow.engine.service.broker;

import com.signalflow.engine.exception.BrokerRejectedException;
import com.signalflow.engine.exception.BrokerUnavailableException;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;

public interface BrokerAdapter {

    Venue venue();

    /**
     * Submits a market order and returns its synchronous fill.
     *
     * @throws BrokerRejectedException    the order is invalid for this venue
     * @throws BrokerUnavailableException the venue could not be reached
     */
    Fill submitMarketOrder(String symbol, Trade.Side side, double size);
}
