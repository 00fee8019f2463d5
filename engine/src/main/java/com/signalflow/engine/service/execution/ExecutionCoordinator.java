package com.signalflow.engine.service.execution;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.dto.CycleOutcome;
import com.signalflow.engine.dto.CycleReport;
import com.signalflow.engine.exception.BrokerRejectedException;
import com.signalflow.engine.exception.BrokerUnavailableException;
import com.signalflow.engine.exception.PersistenceUnavailableException;
import com.signalflow.engine.exception.PriceUnavailableException;
import com.signalflow.engine.model.AssetClass;
import com.signalflow.engine.model.SignalStatus;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.TradingSignal;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.repository.TradingSignalRepository;
import com.signalflow.engine.service.broker.AssetClassifier;
import com.signalflow.engine.service.broker.BrokerRouter;
import com.signalflow.engine.service.broker.Fill;
import com.signalflow.engine.service.marketdata.PriceOracle;
import com.signalflow.engine.service.metrics.EngineMetrics;
import com.signalflow.engine.service.portfolio.OpenPosition;
import com.signalflow.engine.service.portfolio.PortfolioState;
import com.signalflow.engine.service.portfolio.PortfolioStateLoader;
import com.signalflow.engine.service.portfolio.VenuePortfolio;
import com.signalflow.engine.service.risk.RejectReason;
import com.signalflow.engine.service.risk.RiskDecision;
import com.signalflow.engine.service.risk.RiskGate;
import com.signalflow.engine.service.scheduling.Stage;
import com.signalflow.engine.service.scheduling.StageLockRegistry;
import com.signalflow.engine.service.sizing.PositionSize;
import com.signalflow.engine.service.sizing.PositionSizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns ACTIVE signals into trades or terminal rejections. Signals are handled oldest
 * first and one at a time; a failure on one signal never stops the others. Only a
 * persistence outage aborts the cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionCoordinator {

    private final TradingSignalRepository signalRepository;
    private final AssetClassifier assetClassifier;
    private final PortfolioStateLoader portfolioStateLoader;
    private final RiskGate riskGate;
    private final PriceOracle priceOracle;
    private final PositionSizer positionSizer;
    private final BrokerRouter brokerRouter;
    private final SignalTransitionService transitions;
    private final StageLockRegistry stageLocks;
    private final EngineMetrics engineMetrics;
    private final EngineProperties properties;
    private final Clock clock;

    public CycleReport runExecutionCycle() {
        Instant startedAt = clock.instant();
        CycleReport.Builder report = CycleReport.builder(Stage.EXECUTION, startedAt);
        String previousCorrelationId = MDC.get("correlationId");
        MDC.put("correlationId", "exec-" + UUID.randomUUID());
        List<StageLockRegistry.StageLock> locks = new ArrayList<>();
        try {
            List<TradingSignal> pending = loadPending();
            if (pending.isEmpty()) {
                log.debug("No active signals");
                return finish(report);
            }

            List<Routed> routed = new ArrayList<>(pending.size());
            Set<Venue> wanted = EnumSet.noneOf(Venue.class);
            for (TradingSignal signal : pending) {
                Venue venue = Venue.of(assetClassifier.classify(signal));
                routed.add(new Routed(signal, venue));
                wanted.add(venue);
            }

            Set<Venue> locked = EnumSet.noneOf(Venue.class);
            for (Venue venue : wanted) {
                Optional<StageLockRegistry.StageLock> lock = stageLocks.tryAcquire(Stage.EXECUTION, venue);
                if (lock.isPresent()) {
                    locks.add(lock.get());
                    locked.add(venue);
                } else {
                    log.info("Execution already running for {}, coalescing", venue);
                    report.coalesced(venue);
                }
            }
            if (locked.isEmpty()) {
                return finish(report);
            }

            PortfolioState state = loadState(locked);
            Instant now = clock.instant();
            log.info("Execution cycle: {} active signals across {}", pending.size(), locked);

            for (Routed entry : routed) {
                if (!locked.contains(entry.venue())) {
                    continue;
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Execution cycle interrupted, remaining signals left ACTIVE");
                    report.cancelled();
                    break;
                }
                report.record(processSafely(entry.signal(), entry.venue(), state, now));
            }
            return finish(report);
        } catch (PersistenceUnavailableException e) {
            engineMetrics.recordCycleFailure(Stage.EXECUTION);
            throw e;
        } finally {
            locks.forEach(StageLockRegistry.StageLock::close);
            restoreCorrelationId(previousCorrelationId);
        }
    }

    private CycleOutcome processSafely(TradingSignal signal, Venue venue, PortfolioState state, Instant now) {
        try {
            return process(signal, venue, state, now);
        } catch (DataIntegrityViolationException e) {
            log.warn("Signal {} collided with an existing open position on {}:{}", signal.getId(), venue, signal.getSymbol());
            return reject(signal, RejectReason.POSITION_ALREADY_EXISTS, "Open position on " + signal.getSymbol());
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException("Store unavailable while processing signal " + signal.getId(), e);
        } catch (PersistenceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Signal {} failed unexpectedly", signal.getId(), e);
            try {
                return transitions.fail(signal.getId(), e.getClass().getSimpleName() + ": " + e.getMessage())
                        ? CycleOutcome.FAILED
                        : CycleOutcome.SKIPPED;
            } catch (DataAccessException storeError) {
                throw new PersistenceUnavailableException("Store unavailable while failing signal " + signal.getId(), storeError);
            }
        }
    }

    private CycleOutcome process(TradingSignal signal, Venue venue, PortfolioState state, Instant now) {
        EngineProperties.VenueProperties config = properties.venue(venue);
        AssetClass assetClass = venue.assetClass();

        RiskDecision decision = riskGate.evaluate(signal, assetClass, state.venue(venue), config, now);
        if (!decision.allowed()) {
            return reject(signal, decision.reason(), decision.message());
        }

        double price;
        try {
            price = priceOracle.latestPrice(signal.getSymbol());
        } catch (PriceUnavailableException e) {
            log.warn("No price for {}, signal {} deferred: {}", signal.getSymbol(), signal.getId(), e.getMessage());
            return CycleOutcome.DEFERRED;
        }

        PositionSize size = positionSizer.size(signal.getConfidence(), config, state.venue(venue).cash(), price);
        if (!size.isTradable()) {
            return reject(signal, RejectReason.POSITION_SIZE_TOO_SMALL,
                    String.format("Sized to %.8f at price %.4f", size.size(), price));
        }

        if (properties.getExecution().isRevalidateBeforeSubmit()) {
            VenuePortfolio fresh = portfolioStateLoader.loadVenue(venue);
            state.replace(fresh);
            RiskDecision recheck = riskGate.evaluatePortfolio(signal, fresh, config);
            if (!recheck.allowed()) {
                return reject(signal, recheck.reason(), recheck.message());
            }
        }

        Trade.Side side = signal.getDirection().toSide();
        Fill fill;
        try {
            fill = brokerRouter.submit(venue, signal.getSymbol(), side, size.size());
        } catch (BrokerRejectedException e) {
            log.warn("Broker rejected signal {}: {}", signal.getId(), e.getMessage());
            return transitions.fail(signal.getId(), e.getMessage()) ? CycleOutcome.FAILED : CycleOutcome.SKIPPED;
        } catch (BrokerUnavailableException e) {
            log.warn("Broker unavailable for {}, signal {} deferred: {}", venue, signal.getId(), e.getMessage());
            return CycleOutcome.DEFERRED;
        }

        Optional<Trade> opened = transitions.openTrade(signal, venue, fill, size.size(), config);
        if (opened.isEmpty()) {
            return CycleOutcome.SKIPPED;
        }
        state.recordOpened(venue, OpenPosition.of(opened.get(), fill.price()));
        return CycleOutcome.EXECUTED;
    }

    private CycleOutcome reject(TradingSignal signal, RejectReason reason, String message) {
        log.info("Signal {} {} rejected: {} ({})", signal.getId(), signal.getSymbol(), reason.code(), message);
        engineMetrics.recordReject(reason);
        return transitions.reject(signal.getId(), reason, message) ? CycleOutcome.REJECTED : CycleOutcome.SKIPPED;
    }

    private List<TradingSignal> loadPending() {
        try {
            return signalRepository.findByStatusOrderByGeneratedAtAsc(SignalStatus.ACTIVE);
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException("Unable to load active signals", e);
        }
    }

    private PortfolioState loadState(Set<Venue> venues) {
        try {
            return portfolioStateLoader.load(venues);
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException("Unable to load portfolio state", e);
        }
    }

    private CycleReport finish(CycleReport.Builder builder) {
        CycleReport report = builder.build(clock.instant());
        engineMetrics.recordCycle(report);
        log.info("Execution cycle done: {} executed, {} rejected, {} failed, {} deferred, {} skipped{}",
                report.count(CycleOutcome.EXECUTED), report.count(CycleOutcome.REJECTED),
                report.count(CycleOutcome.FAILED), report.count(CycleOutcome.DEFERRED),
                report.count(CycleOutcome.SKIPPED),
                report.coalescedVenues().isEmpty() ? "" : ", coalesced " + report.coalescedVenues());
        return report;
    }

    private record Routed(TradingSignal signal, Venue venue) {}

    private static void restoreCorrelationId(String previous) {
        if (previous == null) {
            MDC.remove("correlationId");
        } else {
            MDC.put("correlationId", previous);
        }
    }
}
