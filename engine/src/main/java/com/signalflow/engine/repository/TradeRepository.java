package com.signalflow.engine.repository;

import com.signalflow.engine.model.Trade;
import com.signalflow.engine.model.Venue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface TradeRepository extends JpaRepository<Trade, Long> {

    List<Trade> findByStatus(Trade.TradeStatus status);

    List<Trade> findByExchangeAndStatusOrderByEntryTimeAsc(Venue exchange, Trade.TradeStatus status);

    List<Trade> findByStatusAndExitTimeGreaterThanEqual(Trade.TradeStatus status, Instant from);

    List<Trade> findByOriginatingSignalId(String signalId);

    Optional<Trade> findByOpenPositionKey(String openPositionKey);

    // Realized PnL of trades closed at or after the given instant, null when none
    @Query("select sum(t.pnl) from Trade t where t.exchange = :exchange and t.status = :status and t.exitTime >= :from")
    Double sumPnlClosedSince(@Param("exchange") Venue exchange,
                             @Param("status") Trade.TradeStatus status,
                             @Param("from") Instant from);

    @Query("select sum(t.pnl) from Trade t where t.exchange = :exchange and t.status = :status")
    Double sumPnl(@Param("exchange") Venue exchange, @Param("status") Trade.TradeStatus status);

    /**
     * Writes the exit fields only while the trade is still open. Returns 0 if another
     * cycle closed it first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Trade t set t.status = :closed, t.exitPrice = :exitPrice, t.exitTime = :exitTime, "
            + "t.exitReason = :reason, t.pnl = :pnl, t.pnlPct = :pnlPct, t.holdingPeriodHours = :hours, "
            + "t.openPositionKey = null "
            + "where t.id = :id and t.status = :open")
    int closeIfOpen(@Param("id") Long id,
                    @Param("open") Trade.TradeStatus open,
                    @Param("closed") Trade.TradeStatus closed,
                    @Param("exitPrice") double exitPrice,
                    @Param("exitTime") Instant exitTime,
                    @Param("reason") Trade.ExitReason reason,
                    @Param("pnl") double pnl,
                    @Param("pnlPct") double pnlPct,
                    @Param("hours") double hours);
}
