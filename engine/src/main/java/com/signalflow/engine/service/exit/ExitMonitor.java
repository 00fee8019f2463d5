package com.signalflow.engine.service.exit;

import com.signalflow.engine.dto.CycleOutcome;
import com.signalflow.engine.dto.CycleReport;
import com.signalflow.engine.exception.PersistenceUnavailableException;
import com.signalflow.engine.exception.PriceUnavailableException;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.repository.TradeRepository;
import com.signalflow.engine.service.marketdata.PriceOracle;
import com.signalflow.engine.service.metrics.EngineMetrics;
import com.signalflow.engine.service.metrics.MetricsCalculator;
import com.signalflow.engine.service.portfolio.PortfolioAccountant;
import com.signalflow.engine.service.scheduling.Stage;
import com.signalflow.engine.service.scheduling.StageLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks every open trade against the latest price, closes those past their stop or
 * target, then snapshots each venue and refreshes performance metrics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExitMonitor {

    private final TradeRepository tradeRepository;
    private final PriceOracle priceOracle;
    private final ExitEvaluator exitEvaluator;
    private final TradeCloseService tradeCloseService;
    private final PortfolioAccountant portfolioAccountant;
    private final MetricsCalculator metricsCalculator;
    private final StageLockRegistry stageLocks;
    private final EngineMetrics engineMetrics;
    private final Clock clock;

    public CycleReport runExitCycle() {
        CycleReport.Builder report = CycleReport.builder(Stage.EXIT, clock.instant());
        String previousCorrelationId = MDC.get("correlationId");
        MDC.put("correlationId", "exit-" + UUID.randomUUID());
        try {
            for (Venue venue : Venue.values()) {
                if (Thread.currentThread().isInterrupted()) {
                    report.cancelled();
                    break;
                }
                Optional<StageLockRegistry.StageLock> lock = stageLocks.tryAcquire(Stage.EXIT, venue);
                if (lock.isEmpty()) {
                    log.info("Exit monitoring already running for {}, coalescing", venue);
                    report.coalesced(venue);
                    continue;
                }
                try (StageLockRegistry.StageLock ignored = lock.get()) {
                    monitorVenue(venue, report);
                }
            }
            if (!report.isCancelled()) {
                metricsCalculator.calculate();
            }
        } catch (DataAccessException e) {
            engineMetrics.recordCycleFailure(Stage.EXIT);
            throw new PersistenceUnavailableException("Store unavailable during exit monitoring", e);
        } finally {
            if (previousCorrelationId == null) {
                MDC.remove("correlationId");
            } else {
                MDC.put("correlationId", previousCorrelationId);
            }
        }

        CycleReport result = report.build(clock.instant());
        engineMetrics.recordCycle(result);
        log.info("Exit cycle done: {} closed, {} still open, {} skipped{}",
                result.count(CycleOutcome.CLOSED), result.count(CycleOutcome.STILL_OPEN),
                result.count(CycleOutcome.SKIPPED),
                result.coalescedVenues().isEmpty() ? "" : ", coalesced " + result.coalescedVenues());
        return result;
    }

    /**
     * Closes a trade by hand at the given price. False when it was already closed.
     */
    public boolean closeManually(Long tradeId, double exitPrice) {
        return tradeCloseService.closeManually(tradeId, exitPrice);
    }

    private void monitorVenue(Venue venue, CycleReport.Builder report) {
        List<Trade> open = tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(venue, Trade.TradeStatus.OPEN);
        Map<String, Double> prices = new HashMap<>();
        boolean interrupted = false;
        for (Trade trade : open) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Exit cycle interrupted on {}, remaining trades left for the next run", venue);
                report.cancelled();
                interrupted = true;
                break;
            }
            report.record(checkSafely(trade, prices));
        }
        if (!interrupted) {
            portfolioAccountant.record(venue, prices);
        }
    }

    private CycleOutcome checkSafely(Trade trade, Map<String, Double> prices) {
        try {
            return check(trade, prices);
        } catch (DataAccessException | PersistenceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Exit check failed for trade {} {}, skipped", trade.getId(), trade.getSymbol(), e);
            return CycleOutcome.SKIPPED;
        }
    }

    private CycleOutcome check(Trade trade, Map<String, Double> prices) {
        double price;
        try {
            price = priceOracle.latestPrice(trade.getSymbol());
        } catch (PriceUnavailableException e) {
            log.warn("No price for trade {} {}, skipped: {}", trade.getId(), trade.getSymbol(), e.getMessage());
            return CycleOutcome.SKIPPED;
        }

        Optional<ExitDecision> exit = exitEvaluator.evaluate(trade, price);
        if (exit.isEmpty()) {
            prices.put(trade.getSymbol(), price);
            return CycleOutcome.STILL_OPEN;
        }
        boolean closed = tradeCloseService.close(trade, exit.get().exitPrice(), exit.get().reason());
        return closed ? CycleOutcome.CLOSED : CycleOutcome.SKIPPED;
    }
}
