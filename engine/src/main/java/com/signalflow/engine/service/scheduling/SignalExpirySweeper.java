package com.signalflow.engine.service.scheduling;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.dto.CycleOutcome;
import com.signalflow.engine.dto.CycleReport;
import com.signalflow.engine.exception.PersistenceUnavailableException;
import com.signalflow.engine.model.SignalStatus;
import com.signalflow.engine.model.TradingSignal;
import com.signalflow.engine.repository.TradingSignalRepository;
import com.signalflow.engine.service.execution.SignalTransitionService;
import com.signalflow.engine.service.metrics.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Retires ACTIVE signals that nothing picked up within {@code engine.signals.stale-after}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalExpirySweeper {

    private final TradingSignalRepository signalRepository;
    private final SignalTransitionService transitions;
    private final EngineMetrics engineMetrics;
    private final EngineProperties properties;
    private final Clock clock;

    public CycleReport sweep() {
        Instant now = clock.instant();
        CycleReport.Builder report = CycleReport.builder(Stage.EXPIRY, now);
        Instant cutoff = now.minus(properties.getSignals().getStaleAfter());
        try {
            List<TradingSignal> stale = signalRepository.findByStatusAndGeneratedAtBefore(SignalStatus.ACTIVE, cutoff);
            for (TradingSignal signal : stale) {
                report.record(transitions.expire(signal.getId()) ? CycleOutcome.EXPIRED : CycleOutcome.SKIPPED);
            }
        } catch (DataAccessException e) {
            engineMetrics.recordCycleFailure(Stage.EXPIRY);
            throw new PersistenceUnavailableException("Store unavailable during signal expiry", e);
        }
        CycleReport result = report.build(clock.instant());
        engineMetrics.recordCycle(result);
        if (result.count(CycleOutcome.EXPIRED) > 0) {
            log.info("Expired {} signals generated before {}", result.count(CycleOutcome.EXPIRED), cutoff);
        }
        return result;
    }
}
