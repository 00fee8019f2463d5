package com.signalflow.engine.service.sizing;

import com.signalflow.engine.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fractional Kelly sizing.
 * <pre>
 *   b     = take_profit_pct / stop_loss_pct
 *   kelly = max(0, (b*p - (1-p)) / b) * kelly_fraction, capped at max_position_size_pct
 *   size  = cash * kelly / price
 * </pre>
 * Any degenerate input (no stop distance, no edge, no cash, no price) yields size 0,
 * which callers treat as "skip", never as an error.
 */
@Slf4j
@Service
public class PositionSizer {

    public PositionSize size(double confidence,
                             EngineProperties.VenueProperties config,
                             double availableCash,
                             double currentPrice) {
        double stopLossPct = config.getDefaultStopLossPct();
        double takeProfitPct = config.getDefaultTakeProfitPct();
        if (stopLossPct <= 0) {
            log.warn("Sizing skipped: stop loss pct is {}", stopLossPct);
            return PositionSize.ZERO;
        }
        if (!(confidence > 0) || !(availableCash > 0) || !(currentPrice > 0)) {
            return PositionSize.ZERO;
        }

        double b = takeProfitPct / stopLossPct;
        if (!(b > 0)) {
            return PositionSize.ZERO;
        }
        double p = Math.min(confidence, 1.0);
        double q = 1.0 - p;

        double kellyPct = Math.max(0.0, (b * p - q) / b);
        kellyPct = Math.min(kellyPct * config.getKellyFraction(), config.getMaxPositionSizePct() / 100.0);
        if (!(kellyPct > 0)) {
            return PositionSize.ZERO;
        }

        double positionValue = availableCash * kellyPct;
        double size = positionValue / currentPrice;
        log.info("Sizing: p={} b={} kelly={}% value={} size={}",
                p, b, String.format("%.2f", kellyPct * 100), String.format("%.2f", positionValue), size);
        return new PositionSize(kellyPct, positionValue, size);
    }
}
