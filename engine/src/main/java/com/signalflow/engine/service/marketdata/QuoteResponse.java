package com.signalflow.engine.service.marketdata;

public record QuoteResponse(String symbol, Double price) {}
