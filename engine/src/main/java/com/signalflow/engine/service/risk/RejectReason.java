package com.signalflow.engine.service.risk;

import java.util.Locale;

public enum RejectReason {
    CONFIDENCE_TOO_LOW,
    SIGNAL_EXPIRED,
    MARKET_CLOSED,
    MAX_RISK_EXCEEDED,
    POSITION_ALREADY_EXISTS,
    DAILY_LOSS_LIMIT_HIT,
    POSITION_SIZE_TOO_SMALL;

    /** Reason code as stored on the signal row, e.g. {@code daily_loss_limit_hit}. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
