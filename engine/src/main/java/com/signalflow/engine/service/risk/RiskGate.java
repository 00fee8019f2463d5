package com.signalflow.engine.service.risk;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.model.AssetClass;
import com.signalflow.engine.model.TradingSignal;
import com.signalflow.engine.service.portfolio.VenuePortfolio;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Pre-trade validation. Checks run in a fixed order and the first failure decides the
 * rejection reason. Reads only its arguments; never touches a store.
 */
@Service
@RequiredArgsConstructor
public class RiskGate {

    private final TradingWindowService tradingWindowService;

    public RiskDecision evaluate(TradingSignal signal,
                                 AssetClass assetClass,
                                 VenuePortfolio portfolio,
                                 EngineProperties.VenueProperties config,
                                 Instant now) {
        if (signal.getConfidence() < config.getMinConfidence()) {
            return RiskDecision.reject(
                    RejectReason.CONFIDENCE_TOO_LOW,
                    String.format("Confidence %.2f below %.2f", signal.getConfidence(), config.getMinConfidence()),
                    config.getMinConfidence(),
                    signal.getConfidence()
            );
        }

        Duration age = Duration.between(signal.getGeneratedAt(), now);
        if (age.compareTo(config.getMaxSignalAge()) > 0) {
            return RiskDecision.reject(
                    RejectReason.SIGNAL_EXPIRED,
                    "Signal is " + age.toMinutes() + "min old",
                    (double) config.getMaxSignalAge().toMinutes(),
                    (double) age.toMinutes()
            );
        }

        if (assetClass == AssetClass.EQUITY) {
            TradingWindowService.WindowDecision window = tradingWindowService.evaluate(now, config.getTradingHours());
            if (!window.allowed()) {
                return RiskDecision.reject(RejectReason.MARKET_CLOSED, window.reason());
            }
        }

        return evaluatePortfolio(signal, portfolio, config);
    }

    /**
     * Portfolio-dependent checks only: exposure, duplicate position and the daily loss
     * circuit breaker. Used on its own to re-validate against a fresher portfolio.
     */
    public RiskDecision evaluatePortfolio(TradingSignal signal,
                                          VenuePortfolio portfolio,
                                          EngineProperties.VenueProperties config) {
        double exposurePct = portfolio.exposurePct();
        if (exposurePct >= config.getMaxPortfolioRiskPct()) {
            return RiskDecision.reject(
                    RejectReason.MAX_RISK_EXCEEDED,
                    String.format("Exposure %.1f%% at or above %.1f%%", exposurePct, config.getMaxPortfolioRiskPct()),
                    config.getMaxPortfolioRiskPct(),
                    exposurePct
            );
        }

        if (portfolio.hasOpenPosition(signal.getSymbol())) {
            return RiskDecision.reject(RejectReason.POSITION_ALREADY_EXISTS, "Open position on " + signal.getSymbol());
        }

        double dailyPnl = portfolio.dailyRealizedPnl();
        double base = portfolio.portfolioValue();
        if (dailyPnl < 0) {
            double lossPct = base > 0 ? Math.abs(dailyPnl / base) * 100.0 : Double.POSITIVE_INFINITY;
            if (lossPct > config.getMaxDailyLossPct()) {
                return RiskDecision.reject(
                        RejectReason.DAILY_LOSS_LIMIT_HIT,
                        String.format("Daily loss %.1f%% above %.1f%%", lossPct, config.getMaxDailyLossPct()),
                        config.getMaxDailyLossPct(),
                        lossPct
                );
            }
        }

        return RiskDecision.allow();
    }
}
