package com.signalflow.engine.service.broker;

import java.time.Instant;

public record Fill(double price, String brokerRef, Instant timestamp) {}
