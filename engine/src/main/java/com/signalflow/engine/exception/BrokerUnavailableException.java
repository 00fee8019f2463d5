package com.signalflow.engine.exception;

/**
 * Transient broker failure (timeout, connectivity). Retried, then treated as a
 * recoverable per-signal failure.
 */
public class BrokerUnavailableException extends TradingException {
    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
