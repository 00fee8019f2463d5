package com.signalflow.engine.service.risk;

public record RiskDecision(
        boolean allowed,
        RejectReason reason,
        String message,
        Double threshold,      // Limit that was breached
        Double currentValue    // Observed value that breached it
) {
    public static RiskDecision allow() {
        return new RiskDecision(true, null, null, null, null);
    }

    public static RiskDecision reject(RejectReason reason, String message, Double threshold, Double currentValue) {
        return new RiskDecision(false, reason, message, threshold, currentValue);
    }

    public static RiskDecision reject(RejectReason reason, String message) {
        return reject(reason, message, null, null);
    }
}
