package com.signalflow.engine.repository;

import com.signalflow.engine.model.PortfolioSnapshot;
import com.signalflow.engine.model.Venue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PortfolioSnapshotRepository extends JpaRepository<PortfolioSnapshot, Long> {

    Optional<PortfolioSnapshot> findFirstByExchangeAndSymbolOrderByTimestampDescIdDesc(Venue exchange, String symbol);

    List<PortfolioSnapshot> findByExchangeAndSymbolOrderByTimestampAsc(Venue exchange, String symbol);
}
