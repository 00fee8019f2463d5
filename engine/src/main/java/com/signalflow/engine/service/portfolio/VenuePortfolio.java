package com.signalflow.engine.service.portfolio;

import com.signalflow.engine.model.Venue;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk-relevant state of one venue: free cash, open positions and the realized PnL
 * of trades closed today.
 */
public record VenuePortfolio(Venue venue, double cash, List<OpenPosition> positions, double dailyRealizedPnl) {

    public VenuePortfolio {
        positions = List.copyOf(positions);
    }

    public static VenuePortfolio empty(Venue venue, double cash) {
        return new VenuePortfolio(venue, cash, List.of(), 0.0);
    }

    public double positionValue() {
        return positions.stream().mapToDouble(OpenPosition::exposure).sum();
    }

    public double totalValue() {
        return cash + positions.stream().mapToDouble(OpenPosition::marketValue).sum();
    }

    /** Σ|position value| / total value, in percent. */
    public double exposurePct() {
        double total = totalValue();
        if (total <= 0) {
            return 0.0;
        }
        return positionValue() / total * 100.0;
    }

    public boolean hasOpenPosition(String symbol) {
        return positions.stream().anyMatch(p -> p.symbol().equals(symbol));
    }

    /** Value the daily loss is measured against: total value, or cash when nothing is valued yet. */
    public double portfolioValue() {
        double total = totalValue();
        return total > 0 ? total : cash;
    }

    public VenuePortfolio withOpened(OpenPosition position) {
        List<OpenPosition> next = new ArrayList<>(positions);
        next.add(position);
        return new VenuePortfolio(venue, cash - position.costBasis(), next, dailyRealizedPnl);
    }
}
