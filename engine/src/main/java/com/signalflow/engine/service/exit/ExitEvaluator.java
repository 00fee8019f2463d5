package com.signalflow.engine.service.exit;

import com.signalflow.engine.model.Trade;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Compares a price against a trade's stop and target. A price past both levels is
 * treated as a stop.
 */
@Component
public class ExitEvaluator {

    public Optional<ExitDecision> evaluate(Trade trade, double price) {
        if (trade.isLong()) {
            if (price <= trade.getStopLoss()) {
                return Optional.of(new ExitDecision(Trade.ExitReason.STOP_LOSS, price));
            }
            if (price >= trade.getTakeProfit()) {
                return Optional.of(new ExitDecision(Trade.ExitReason.TAKE_PROFIT, price));
            }
            return Optional.empty();
        }
        if (price >= trade.getStopLoss()) {
            return Optional.of(new ExitDecision(Trade.ExitReason.STOP_LOSS, price));
        }
        if (price <= trade.getTakeProfit()) {
            return Optional.of(new ExitDecision(Trade.ExitReason.TAKE_PROFIT, price));
        }
        return Optional.empty();
    }
}
