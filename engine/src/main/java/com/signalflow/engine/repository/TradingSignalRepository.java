package com.signalflow.engine.repository;

import com.signalflow.engine.model.SignalStatus;
import com.signalflow.engine.model.TradingSignal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TradingSignalRepository extends JpaRepository<TradingSignal, String> {

    List<TradingSignal> findByStatusOrderByGeneratedAtAsc(SignalStatus status);

    List<TradingSignal> findByStatusAndGeneratedAtBefore(SignalStatus status, Instant cutoff);

    /**
     * Moves a signal out of {@code expected} into a terminal status. Returns 0 when the
     * signal has already left {@code expected}, which makes repeated transitions no-ops.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TradingSignal s set s.status = :target, s.rejectionReason = :reason, "
            + "s.executionDetails = :details, s.processedAt = :processedAt "
            + "where s.id = :id and s.status = :expected")
    int transition(@Param("id") String id,
                   @Param("expected") SignalStatus expected,
                   @Param("target") SignalStatus target,
                   @Param("reason") String reason,
                   @Param("details") String details,
                   @Param("processedAt") Instant processedAt);
}
