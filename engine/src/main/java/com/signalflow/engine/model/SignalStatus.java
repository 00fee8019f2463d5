package com.signalflow.engine.model;

public enum SignalStatus {
    ACTIVE,
    EXECUTED,
    REJECTED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
