package com.signalflow.engine.service.portfolio;

import com.signalflow.engine.model.Trade;

/**
 * An open trade valued at its latest known mark.
 */
public record OpenPosition(String symbol, Trade.Side side, double size, double entryPrice, double markPrice) {

    public static OpenPosition of(Trade trade, double markPrice) {
        return new OpenPosition(trade.getSymbol(), trade.getSide(), trade.getSize(), trade.getEntryPrice(), markPrice);
    }

    public double costBasis() {
        return size * entryPrice;
    }

    public double exposure() {
        return Math.abs(size * markPrice);
    }

    public double unrealizedPnl() {
        double diff = (markPrice - entryPrice) * size;
        return side == Trade.Side.SHORT ? -diff : diff;
    }

    public double marketValue() {
        return costBasis() + unrealizedPnl();
    }
}
