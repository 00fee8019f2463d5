package com.signalflow.engine.service.exit;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.model.Trade;

/**
 * Protective stop and profit target derived from the fill price. Shorts mirror longs.
 */
public record ExitLevels(double stopLoss, double takeProfit) {

    public static ExitLevels of(Trade.Side side, double entryPrice, EngineProperties.VenueProperties config) {
        double sl = config.getDefaultStopLossPct() / 100.0;
        double tp = config.getDefaultTakeProfitPct() / 100.0;
        if (side == Trade.Side.SHORT) {
            return new ExitLevels(entryPrice * (1 + sl), entryPrice * (1 - tp));
        }
        return new ExitLevels(entryPrice * (1 - sl), entryPrice * (1 + tp));
    }
}
