package com.signalflow.engine.dto;

public enum CycleOutcome {
    EXECUTED,
    REJECTED,
    FAILED,
    DEFERRED,
    EXPIRED,
    CLOSED,
    STILL_OPEN,
    SKIPPED
}
