package com.signalflow.engine.service.portfolio;

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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appends one snapshot row per priced open position and one TOTAL row per venue.
 * Positions without a price this cycle count towards the TOTAL at cost with no
 * unrealized PnL and get no row of their own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioAccountant {

    private final TradeRepository tradeRepository;
    private final PortfolioSnapshotRepository snapshotRepository;
    private final PortfolioStateLoader portfolioStateLoader;
    private final Clock clock;

    @Transactional
    public List<PortfolioSnapshot> record(Venue venue, Map<String, Double> prices) {
        Instant timestamp = clock.instant();
        double cash = portfolioStateLoader.loadVenue(venue).cash();
        List<Trade> open = tradeRepository.findByExchangeAndStatusOrderByEntryTimeAsc(venue, Trade.TradeStatus.OPEN);

        List<PortfolioSnapshot> rows = new ArrayList<>();
        double costBasis = 0.0;
        double unrealized = 0.0;
        for (Trade trade : open) {
            Double price = prices.get(trade.getSymbol());
            OpenPosition position = OpenPosition.of(trade, price != null && price > 0 ? price : trade.getEntryPrice());
            costBasis += position.costBasis();
            if (price == null || price <= 0) {
                continue;
            }
            unrealized += position.unrealizedPnl();
            rows.add(PortfolioSnapshot.builder()
                    .timestamp(timestamp)
                    .exchange(venue)
                    .symbol(trade.getSymbol())
                    .positionSize(trade.getSize())
                    .avgEntryPrice(trade.getEntryPrice())
                    .currentPrice(price)
                    .unrealizedPnl(position.unrealizedPnl())
                    .totalCash(cash)
                    .totalValue(position.marketValue())
                    .build());
        }

        rows.add(PortfolioSnapshot.builder()
                .timestamp(timestamp)
                .exchange(venue)
                .symbol(PortfolioSnapshot.TOTAL)
                .positionSize(open.size())
                .avgEntryPrice(0.0)
                .currentPrice(0.0)
                .unrealizedPnl(unrealized)
                .totalCash(cash)
                .totalValue(open.isEmpty() ? 0.0 : costBasis + unrealized)
                .build());

        List<PortfolioSnapshot> saved = snapshotRepository.saveAll(rows);
        log.info("{} snapshot: {} open positions, unrealized={} value={} cash={}",
                venue, open.size(), String.format("%.2f", unrealized),
                String.format("%.2f", costBasis + unrealized), String.format("%.2f", cash));
        return saved;
    }
}
