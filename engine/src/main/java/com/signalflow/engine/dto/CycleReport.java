package com.signalflow.engine.dto;

import com.signalflow.engine.model.Venue;
import com.signalflow.engine.service.scheduling.Stage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one stage invocation, handed back to the scheduler or operator.
 * {@code coalescedVenues} lists venues skipped because the same stage was already
 * running for them.
 */
public record CycleReport(
        Stage stage,
        Map<CycleOutcome, Integer> counts,
        List<Venue> coalescedVenues,
        boolean cancelled,
        Instant startedAt,
        Instant finishedAt
) {

    public CycleReport {
        counts = Collections.unmodifiableMap(new EnumMap<>(counts));
        coalescedVenues = List.copyOf(coalescedVenues);
    }

    public int count(CycleOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public static Builder builder(Stage stage, Instant startedAt) {
        return new Builder(stage, startedAt);
    }

    public static final class Builder {
        private final Stage stage;
        private final Instant startedAt;
        private final Map<CycleOutcome, Integer> counts = new EnumMap<>(CycleOutcome.class);
        private final List<Venue> coalesced = new ArrayList<>();
        private boolean cancelled;

        private Builder(Stage stage, Instant startedAt) {
            this.stage = stage;
            this.startedAt = startedAt;
        }

        public Builder record(CycleOutcome outcome) {
            counts.merge(outcome, 1, Integer::sum);
            return this;
        }

        public Builder coalesced(Venue venue) {
            coalesced.add(venue);
            return this;
        }

        public Builder cancelled() {
            this.cancelled = true;
            return this;
        }

        public boolean isCancelled() {
            return cancelled;
        }

        public CycleReport build(Instant finishedAt) {
            return new CycleReport(stage, counts, coalesced, cancelled, startedAt, finishedAt);
        }
    }
}
