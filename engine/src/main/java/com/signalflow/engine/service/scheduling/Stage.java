package com.signalflow.engine.service.scheduling;

public enum Stage {
    EXECUTION,
    EXIT,
    EXPIRY
}
