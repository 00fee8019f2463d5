package com.signalflow.engine.service.portfolio;

import com.signalflow.engine.config.EngineProperties;
import com.signalflow.engine.model.PortfolioSnapshot;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;
import com.signalflow.engine.repository.PortfolioSnapshotRepository;
import com.signalflow.engine.repository.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds venue portfolios from the trade ledger. Cash is initial cash plus all realized
 * PnL minus the cost basis of open trades; open trades are marked at their latest
 * snapshot price, or at entry when no newer snapshot exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioStateLoader {

    private final TradeRepository tradeRepository;
    private final PortfolioSnapshotRepository snapshotRepository;
    private final EngineProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PortfolioState load(Collection<Venue> venues) {
        Map<Venue, VenuePortfolio> portfolios = new EnumMap<>(Venue.class);
        for (Venue venue : venues) {
            portfolios.put(venue, loadVenue(venue));
        }
        return new PortfolioState(clock.instant(), portfolios);
    }

    @Transactional(readOnly = true)
    public VenuePortfolio loadVenue(Venue venue) {
        List<Trade> open = tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(venue, Trade.TradeStatus.OPEN);
        List<OpenPosition> positions = new ArrayList<>(open.size());
        double costBasis = 0.0;
        for (Trade trade : open) {
            OpenPosition position = OpenPosition.of(trade, markPrice(trade));
            positions.add(position);
            costBasis += position.costBasis();
        }
        double realized = nullToZero(tradeRepository.sumPnl(venue, Trade.TradeStatus.CLOSED));
        double daily = nullToZero(tradeRepository.sumPnlClosedSince(venue, Trade.TradeStatus.CLOSED, startOfDay()));
        double cash = properties.venue(venue).getInitialCash() + realized - costBasis;
        VenuePortfolio portfolio = new VenuePortfolio(venue, cash, positions, daily);
        log.debug("Loaded {} portfolio: cash={} positions={} exposure={}% dailyPnl={}",
                venue, cash, positions.size(), portfolio.exposurePct(), daily);
        return portfolio;
    }

    private double markPrice(Trade trade) {
        return snapshotRepository.findFirstByExchangeAndSymbolOrderByTimestampDescIdDesc(trade.getExchange(), trade.getSymbol())
                .filter(snapshot -> !snapshot.getTimestamp().isBefore(trade.getEntryTime()))
                .map(PortfolioSnapshot::getCurrentPrice)
                .filter(price -> price > 0)
                .orElse(trade.getEntryPrice());
    }

    private Instant startOfDay() {
        ZoneId zone = ZoneId.of(properties.getAccountingTimezone());
        return LocalDate.now(clock.withZone(zone)).atStartOfDay(zone).toInstant();
    }

    private static double nullToZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
