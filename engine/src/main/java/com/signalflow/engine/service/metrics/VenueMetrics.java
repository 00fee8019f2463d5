package com.signalflow.engine.service.metrics;

import com.signalflow.engine.model.Venue;
import lombok.Builder;

@Builder
public record VenueMetrics(
        Venue venue,
        int totalTrades,
        int winningTrades,
        int losingTrades,
        double winRate,
        double totalPnl,
        double avgPnl,
        double avgPnlPct,
        double sharpe,
        double avgHoldingHours,
        double profitFactor
) {}
