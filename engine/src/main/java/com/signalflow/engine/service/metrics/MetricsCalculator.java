package com.signalflow.engine.service.metrics;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.repository.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rolling-window performance of closed trades per venue. Read-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsCalculator {

    private final TradeRepository tradeRepository;
    private final EngineProperties properties;
    private final EngineMetrics engineMetrics;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Map<Venue, VenueMetrics> calculate() {
        Instant from = clock.instant().minus(properties.getMetrics().getWindow());
        List<Trade> closed = tradeRepository.findByStatusAndExitTimeGreaterThanEqual(Trade.TradeStatus.CLOSED, from);
        if (closed.isEmpty()) {
            log.info("No closed trades in the last {} for metrics", properties.getMetrics().getWindow());
            return Map.of();
        }

        Map<Venue, List<Trade>> byVenue = new EnumMap<>(Venue.class);
        for (Trade trade : closed) {
            byVenue.computeIfAbsent(trade.getExchange(), v -> new ArrayList<>()).add(trade);
        }

        Map<Venue, VenueMetrics> result = new EnumMap<>(Venue.class);
        byVenue.forEach((venue, trades) -> {
            VenueMetrics metrics = calculate(venue, trades);
            result.put(venue, metrics);
            engineMetrics.publish(metrics);
            log.info("{} metrics ({}): trades={} winRate={}% totalPnl={} avgPnl={} sharpe={}",
                    venue, properties.getMetrics().getWindow(), metrics.totalTrades(),
                    String.format("%.1f", metrics.winRate()), String.format("%.2f", metrics.totalPnl()),
                    String.format("%.2f", metrics.avgPnl()), String.format("%.2f", metrics.sharpe()));
        });
        return result;
    }

    public static VenueMetrics calculate(Venue venue, List<Trade> trades) {
        int total = trades.size();
        if (total == 0) {
            return VenueMetrics.builder().venue(venue).build();
        }
        int winners = 0;
        double totalPnl = 0.0;
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        double holdingHours = 0.0;
        double[] returns = new double[total];
        for (int i = 0; i < total; i++) {
            Trade trade = trades.get(i);
            double pnl = value(trade.getPnl());
            if (pnl > 0) {
                winners++;
                grossProfit += pnl;
            } else if (pnl < 0) {
                grossLoss += -pnl;
            }
            totalPnl += pnl;
            holdingHours += value(trade.getHoldingPeriodHours());
            returns[i] = value(trade.getPnlPct());
        }

        double meanReturn = mean(returns);
        double stdev = stdev(returns, meanReturn);
        double sharpe = stdev > 0 ? meanReturn / stdev : 0.0;

        return VenueMetrics.builder()
                .venue(venue)
                .totalTrades(total)
                .winningTrades(winners)
                .losingTrades(total - winners)
                .winRate((double) winners / total * 100.0)
                .totalPnl(totalPnl)
                .avgPnl(totalPnl / total)
                .avgPnlPct(meanReturn)
                .sharpe(sharpe)
                .avgHoldingHours(holdingHours / total)
                .profitFactor(grossLoss == 0 ? grossProfit : grossProfit / grossLoss)
                .build();
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    // population deviation, n denominator
    private static double stdev(double[] values, double mean) {
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / values.length);
    }

    private static double value(Double d) {
        return d == null ? 0.0 : d;
    }
}
