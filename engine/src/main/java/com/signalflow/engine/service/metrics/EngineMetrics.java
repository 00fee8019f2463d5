package com.signalflow.engine.service.metrics;

import com.signalflow.engine.dto.CycleOutcome;
import com.signalflow.engine.dto.CycleReport;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.service.risk.RejectReason;
import com.signalflow.engine.service.scheduling.Stage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
public class EngineMetrics {

    private final MeterRegistry meterRegistry;

    private final Map<Venue, AtomicReference<VenueMetrics>> latest = new ConcurrentHashMap<>();

    public void recordCycle(CycleReport report) {
        for (Map.Entry<CycleOutcome, Integer> entry : report.counts().entrySet()) {
            Counter.builder("engine_cycle_items_total")
                    .tag("stage", report.stage().name())
                    .tag("outcome", entry.getKey().name())
                    .register(meterRegistry)
                    .increment(entry.getValue());
        }
        if (!report.coalescedVenues().isEmpty()) {
            Counter.builder("engine_cycles_coalesced_total")
                    .tag("stage", report.stage().name())
                    .register(meterRegistry)
                    .increment(report.coalescedVenues().size());
        }
        Timer.builder("engine_cycle_duration")
                .tag("stage", report.stage().name())
                .tag("cancelled", Boolean.toString(report.cancelled()))
                .register(meterRegistry)
                .record(report.duration());
    }

    public void recordReject(RejectReason reason) {
        Counter.builder("engine_signals_rejected_total")
                .tag("reason", reason.code())
                .register(meterRegistry)
                .increment();
    }

    public void recordCycleFailure(Stage stage) {
        Counter.builder("engine_cycle_failures_total")
                .tag("stage", stage.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordTaskFailure(String task) {
        Counter.builder("engine_scheduled_task_failures_total")
                .tag("task", task)
                .register(meterRegistry)
                .increment();
    }

    public void publish(VenueMetrics metrics) {
        AtomicReference<VenueMetrics> ref = latest.computeIfAbsent(metrics.venue(), venue -> {
            AtomicReference<VenueMetrics> holder = new AtomicReference<>(metrics);
            Gauge.builder("engine_win_rate", holder, h -> h.get().winRate())
                    .tag("venue", venue.name()).register(meterRegistry);
            Gauge.builder("engine_total_pnl", holder, h -> h.get().totalPnl())
                    .tag("venue", venue.name()).register(meterRegistry);
            Gauge.builder("engine_sharpe", holder, h -> h.get().sharpe())
                    .tag("venue", venue.name()).register(meterRegistry);
            return holder;
        });
        ref.set(metrics);
    }
}
