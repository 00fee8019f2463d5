package com.signalflow.engine.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "trading_signals")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingSignal {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_class", length = 16)
    private AssetClass assetClass;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Direction direction;

    @Column(nullable = false)
    private double confidence;

    @Column(name = "sentiment_score")
    private double sentimentScore;

    // Price quoted by the signal source at generation time, informational only
    @Column(name = "reference_price")
    private Double referencePrice;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SignalStatus status;

    @Column(name = "rejection_reason", length = 64)
    private String rejectionReason;

    @Column(name = "execution_details", length = 512)
    private String executionDetails;

    @Column(name = "processed_at")
    private Instant processedAt;

    public enum Direction {
        BUY,
        SELL;

        public Trade.Side toSide() {
            return this == BUY ? Trade.Side.LONG : Trade.Side.SHORT;
        }
    }
}
