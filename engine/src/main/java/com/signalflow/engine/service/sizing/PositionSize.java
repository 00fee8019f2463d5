package com.signalflow.engine.service.sizing;

/**
 * Output of the sizer. {@code kellyPct} is the final capped fraction of cash (0..1).
 */
public record PositionSize(double kellyPct, double positionValue, double size) {

    public static final PositionSize ZERO = new PositionSize(0.0, 0.0, 0.0);

    public boolean isTradable() {
        return size > 0;
    }
}
