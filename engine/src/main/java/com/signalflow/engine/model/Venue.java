package com.signalflow.engine.model;

/**
 * Trading destination with its own cash, risk limits and open positions.
 * Each asset class is routed to exactly one venue.
 */
public enum Venue {
    ALPACA(AssetClass.EQUITY),
    BINANCE(AssetClass.CRYPTO);

    private final AssetClass assetClass;

    Venue(AssetClass assetClass) {
        this.assetClass = assetClass;
    }

    public AssetClass assetClass() {
        return assetClass;
    }

    public static Venue of(AssetClass assetClass) {
        return assetClass == AssetClass.CRYPTO ? BINANCE : ALPACA;
    }
}
