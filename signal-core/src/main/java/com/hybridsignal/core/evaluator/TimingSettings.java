package com.hybridsignal.core.evaluator;

/**
 * Relative weights of the three oscillator zones in {@link TimingEvaluator}'s strength.
 * Weights are normalized by their sum, so only their ratio matters.
 */
public record TimingSettings(double lineWeight, double signalWeight, double histogramWeight) {

    public TimingSettings {
        if (lineWeight < 0 || signalWeight < 0 || histogramWeight < 0) {
            throw new IllegalArgumentException("timing weights must be non-negative");
        }
        if (lineWeight + signalWeight + histogramWeight <= 0.0) {
            throw new IllegalArgumentException("at least one timing weight must be positive");
        }
    }

    public static TimingSettings defaults() {
        return new TimingSettings(0.4, 0.4, 0.2);
    }

    double total() {
        return lineWeight + signalWeight + histogramWeight;
    }
}
