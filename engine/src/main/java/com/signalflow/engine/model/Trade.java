package com.signalflow.engine.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "trades")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "exchange", nullable = false, length = 16)
    private Venue exchange;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Side side;

    @Column(name = "entry_price", nullable = false)
    private double entryPrice;

    @Column(nullable = false)
    private double size;

    @Column(name = "stop_loss", nullable = false)
    private double stopLoss;

    @Column(name = "take_profit", nullable = false)
    private double takeProfit;

    @Column(name = "entry_time", nullable = false)
    private Instant entryTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private TradeStatus status;

    @Column(name = "exit_price")
    private Double exitPrice;

    @Column(name = "exit_time")
    private Instant exitTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "exit_reason", length = 16)
    private ExitReason exitReason;

    private Double pnl;

    @Column(name = "pnl_pct")
    private Double pnlPct;

    @Column(name = "holding_period_hours")
    private Double holdingPeriodHours;

    @Column(name = "originating_signal_id", nullable = false, length = 64)
    private String originatingSignalId;

    @Column(name = "broker_ref", length = 64)
    private String brokerRef;

    private Double confidence;

    @Column(name = "sentiment_score")
    private Double sentimentScore;

    // EXCHANGE:SYMBOL while open, null once closed; unique in the store
    @Column(name = "open_position_key", length = 64)
    private String openPositionKey;

    public static String positionKey(Venue exchange, String symbol) {
        return exchange.name() + ":" + symbol;
    }

    public boolean isLong() {
        return side == Side.LONG;
    }

    public enum Side { LONG, SHORT }
    public enum TradeStatus { OPEN, CLOSED }
    public enum ExitReason { STOP_LOSS, TAKE_PROFIT, MANUAL }
}
