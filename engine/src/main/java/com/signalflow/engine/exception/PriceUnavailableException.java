package com.signalflow.engine.exception;

/**
 * No usable price for a symbol right now. Recoverable: the affected signal or trade
 * is left untouched and picked up again next cycle.
 */
public class PriceUnavailableException extends TradingException {

    private final String symbol;

    public PriceUnavailableException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public PriceUnavailableException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
