package com.signalflow.engine.service.exit;

import com.signalflow.engine.model.Trade;

public record ExitDecision(Trade.ExitReason reason, double exitPrice) {}
