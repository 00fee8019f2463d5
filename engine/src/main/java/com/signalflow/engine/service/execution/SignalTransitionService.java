package com.signalflow.engine.service.execution;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.model.SignalStatus;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.TradingSignal;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.repository.TradeRepository;
import com.signalflow.engine.repository.TradingSignalRepository;
import com.signalflow.engine.service.broker.Fill;
import com.signalflow.engine.service.exit.ExitLevels;
import com.signalflow.engine.service.risk.RejectReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Terminal transitions of a signal. Every method is a guarded update out of ACTIVE, so
 * a signal that was already processed is left untouched and the call reports false.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalTransitionService {

    private static final int DETAILS_LIMIT = 512;

    private final TradingSignalRepository signalRepository;
    private final TradeRepository tradeRepository;
    private final Clock clock;

    @Transactional
    public boolean reject(String signalId, RejectReason reason, String message) {
        return move(signalId, SignalStatus.REJECTED, reason.code(), message);
    }

    @Transactional
    public boolean fail(String signalId, String message) {
        return move(signalId, SignalStatus.FAILED, "execution_failed", message);
    }

    @Transactional
    public boolean expire(String signalId) {
        return move(signalId, SignalStatus.EXPIRED, "stale", null);
    }

    /**
     * Marks the signal executed and records the opened trade in one transaction.
     * Empty when the signal had already left ACTIVE. A unique-key violation on the
     * open position propagates and rolls both writes back.
     */
    @Transactional
    public Optional<Trade> openTrade(TradingSignal signal,
                                     Venue venue,
                                     Fill fill,
                                     double size,
                                     EngineProperties.VenueProperties config) {
        int updated = signalRepository.transition(signal.getId(), SignalStatus.ACTIVE, SignalStatus.EXECUTED,
                null, "Filled " + size + " @ " + fill.price() + " ref=" + fill.brokerRef(), clock.instant());
        if (updated == 0) {
            log.warn("Signal {} already processed, fill {} not recorded", signal.getId(), fill.brokerRef());
            return Optional.empty();
        }

        Trade.Side side = signal.getDirection().toSide();
        ExitLevels levels = ExitLevels.of(side, fill.price(), config);
        Trade trade = Trade.builder()
                .exchange(venue)
                .symbol(signal.getSymbol())
                .side(side)
                .entryPrice(fill.price())
                .size(size)
                .stopLoss(levels.stopLoss())
                .takeProfit(levels.takeProfit())
                .entryTime(fill.timestamp())
                .status(Trade.TradeStatus.OPEN)
                .originatingSignalId(signal.getId())
                .brokerRef(fill.brokerRef())
                .confidence(signal.getConfidence())
                .sentimentScore(signal.getSentimentScore())
                .openPositionKey(Trade.positionKey(venue, signal.getSymbol()))
                .build();
        Trade saved = tradeRepository.saveAndFlush(trade);
        log.info("Opened trade {} {} {} x{} @ {} (SL {} / TP {}) from signal {}",
                saved.getId(), side, signal.getSymbol(), size, fill.price(),
                levels.stopLoss(), levels.takeProfit(), signal.getId());
        return Optional.of(saved);
    }

    private boolean move(String signalId, SignalStatus target, String reason, String details) {
        int updated = signalRepository.transition(signalId, SignalStatus.ACTIVE, target,
                reason, truncate(details), clock.instant());
        if (updated == 0) {
            log.debug("Signal {} not ACTIVE, {} transition skipped", signalId, target);
            return false;
        }
        return true;
    }

    private static String truncate(String details) {
        if (details == null || details.length() <= DETAILS_LIMIT) {
            return details;
        }
        return details.substring(0, DETAILS_LIMIT);
    }
}
