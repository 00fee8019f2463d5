package com.signalflow.engine.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "portfolio_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSnapshot {

    public static final String TOTAL = "TOTAL";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "snapshot_time", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "exchange", nullable = false, length = 16)
    private Venue exchange;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(name = "position_size", nullable = false)
    private double positionSize;

    @Column(name = "avg_entry_price", nullable = false)
    private double avgEntryPrice;

    @Column(name = "current_price", nullable = false)
    private double currentPrice;

    @Column(name = "unrealized_pnl", nullable = false)
    private double unrealizedPnl;

    @Column(name = "total_cash", nullable = false)
    private double totalCash;

    @Column(name = "total_value", nullable = false)
    private double totalValue;

    public boolean isTotalRow() {
        return TOTAL.equals(symbol);
    }
}
