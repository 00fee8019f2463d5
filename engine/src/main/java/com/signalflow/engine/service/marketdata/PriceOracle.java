package com.signalflow.engine.service.marketdata;

import com.signalflow.engine.exception.PriceUnavailableException;

public interface PriceOracle {

    /**
     * Last known price for the symbol.
     *
     * @throws PriceUnavailableException when no positive price can be obtained within
     *                                   the configured timeout and retry budget
     */
    double latestPrice(String symbol);
}
