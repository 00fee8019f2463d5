package com.signalflow.engine.exception;

/**
 * Definitive order rejection by the broker. The signal is failed and not retried.
 */
public class BrokerRejectedException extends TradingException {
    public BrokerRejectedException(String message) {
        super(message);
    }
}
