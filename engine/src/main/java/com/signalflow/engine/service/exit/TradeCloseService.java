package com.signalflow.engine.service.exit;

import com.signalflow.engine.exception.TradingException;
import com.signalflow.engine.model.Trade;
import com.signalflow.engine.repository.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class TradeCloseService {

    private final TradeRepository tradeRepository;
    private final Clock clock;

    /**
     * Closes the trade at {@code exitPrice} unless it is already closed. Returns false
     * when another cycle got there first.
     */
    @Transactional
    public boolean close(Trade trade, double exitPrice, Trade.ExitReason reason) {
        Instant exitTime = clock.instant();
        double pnl = pnl(trade, exitPrice);
        double costBasis = trade.getEntryPrice() * trade.getSize();
        double pnlPct = costBasis > 0 ? pnl / costBasis * 100.0 : 0.0;
        double hours = Duration.between(trade.getEntryTime(), exitTime).getSeconds() / 3600.0;

        int updated = tradeRepository.closeIfOpen(trade.getId(), Trade.TradeStatus.OPEN, Trade.TradeStatus.CLOSED,
                exitPrice, exitTime, reason, pnl, pnlPct, hours);
        if (updated == 0) {
            log.info("Trade {} already closed, skipping {}", trade.getId(), reason);
            return false;
        }
        log.info("Trade {} {} {} closed on {} @ {}. P&L: {} ({}%) after {}h",
                trade.getId(), trade.getSide(), trade.getSymbol(), reason, exitPrice,
                String.format("%.2f", pnl), String.format("%.2f", pnlPct), String.format("%.1f", hours));
        return true;
    }

    @Transactional
    public boolean closeManually(Long tradeId, double exitPrice) {
        if (!(exitPrice > 0)) {
            throw new TradingException("Exit price must be positive, got " + exitPrice);
        }
        Trade trade = tradeRepository.findById(tradeId)
                .orElseThrow(() -> new TradingException("Trade not found: " + tradeId));
        if (trade.getStatus() == Trade.TradeStatus.CLOSED) {
            return false;
        }
        return close(trade, exitPrice, Trade.ExitReason.MANUAL);
    }

    static double pnl(Trade trade, double exitPrice) {
        double pnl = (exitPrice - trade.getEntryPrice()) * trade.getSize();
        return trade.isLong() ? pnl : -pnl;
    }
}
