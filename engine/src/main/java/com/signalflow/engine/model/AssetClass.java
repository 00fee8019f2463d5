package com.signalflow.engine.model;

public enum AssetClass {
    EQUITY,
    CRYPTO
}
