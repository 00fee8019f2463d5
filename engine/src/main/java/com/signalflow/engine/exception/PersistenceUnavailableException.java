package com.signalflow.engine.exception;

/**
 * The store could not be read or written. Fatal for the running cycle.
 */
public class PersistenceUnavailableException extends TradingException {
    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
