package com.marketlens.common.model;

/**
 * Shared clamping for every 0–100 score on the wire.
 */
public final class Scores {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private Scores() {}

    /** Clamps into [0, 100]; NaN collapses to 0. */
    public static double clamp(double value) {
        if (Double.isNaN(value)) return MIN;
        return Math.max(MIN, Math.min(MAX, value));
    }
}
