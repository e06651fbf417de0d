package com.hybridsignal.core.model;

/**
 * Numeric helpers shared by the evaluators, combiner and aggregator.
 */
public final class Scores {

    private Scores() {}

    /** Clamps to [0.0, 1.0]; NaN collapses to 0.0. */
    public static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static boolean isFinite(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }
}
