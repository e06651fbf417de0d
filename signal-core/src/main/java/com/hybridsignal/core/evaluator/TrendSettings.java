package com.hybridsignal.core.evaluator;

/**
 * Tunables for {@link TrendEvaluator}.
 *
 * @param normalizationSpread relative price/long-average spread that maps to full strength
 *                            (0.05 = a 5% spread scores 1.0)
 * @param mode                {@link TrendEvaluator.Mode#LOCAL} ignores higher-timeframe
 *                            confirmation; {@link TrendEvaluator.Mode#CONFIRMED} requires it
 *                            whenever the caller supplies one
 */
public record TrendSettings(double normalizationSpread, TrendEvaluator.Mode mode) {

    public static final double DEFAULT_NORMALIZATION_SPREAD = 0.05;

    public TrendSettings {
        if (!(normalizationSpread > 0.0)) {
            throw new IllegalArgumentException("normalizationSpread must be > 0, got " + normalizationSpread);
        }
        if (mode == null) {
            mode = TrendEvaluator.Mode.LOCAL;
        }
    }

    public static TrendSettings defaults() {
        return new TrendSettings(DEFAULT_NORMALIZATION_SPREAD, TrendEvaluator.Mode.LOCAL);
    }
}
