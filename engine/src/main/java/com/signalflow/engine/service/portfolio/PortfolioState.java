package com.signalflow.engine.service.portfolio;

import com.signalflow.engine.model.Venue;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-venue portfolio snapshot taken once at the start of a cycle. Positions opened
 * during the cycle are folded in so later signals see them; exposure figures stay as
 * of {@link #asOf()} otherwise.
 */
public final class PortfolioState {

    private final Instant asOf;
    private final Map<Venue, VenuePortfolio> venues;

    public PortfolioState(Instant asOf, Map<Venue, VenuePortfolio> venues) {
        this.asOf = asOf;
        this.venues = new EnumMap<>(Venue.class);
        this.venues.putAll(venues);
    }

    public Instant asOf() {
        return asOf;
    }

    public VenuePortfolio venue(Venue venue) {
        VenuePortfolio portfolio = venues.get(venue);
        if (portfolio == null) {
            throw new IllegalArgumentException("No portfolio loaded for " + venue);
        }
        return portfolio;
    }

    public boolean contains(Venue venue) {
        return venues.containsKey(venue);
    }

    public void recordOpened(Venue venue, OpenPosition position) {
        venues.put(venue, venue(venue).withOpened(position));
    }

    public void replace(VenuePortfolio portfolio) {
        venues.put(portfolio.venue(), portfolio);
    }
}
