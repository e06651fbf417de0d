package com.hybridsignal.core.combiner;

/**
 * Tunables of the {@link SignalCombiner} algebra.
 *
 * @param singleIndicatorFactor strength multiplier when only one of two indicators is directional
 * @param conflictFactor        multiplier on the strength gap when indicators disagree
 * @param majorityFactor        multiplier on the mean strength for a 2-of-3 majority
 * @param weakMajorityRatio     a 2-of-3 majority is demoted to WEAK_* when its mean strength is
 *                              below {@code dissenter.strength × weakMajorityRatio}
 * @param agreementBonus        confidence added when every directional vote agrees
 * @param conflictPenalty       confidence removed when two directional votes oppose
 */
public record CombinerSettings(
    double singleIndicatorFactor,
    double conflictFactor,
    double majorityFactor,
    double weakMajorityRatio,
    double agreementBonus,
    double conflictPenalty
) {

    public CombinerSettings {
        requireNonNegative("singleIndicatorFactor", singleIndicatorFactor);
        requireNonNegative("conflictFactor", conflictFactor);
        requireNonNegative("majorityFactor", majorityFactor);
        requireNonNegative("weakMajorityRatio", weakMajorityRatio);
        requireNonNegative("agreementBonus", agreementBonus);
        requireNonNegative("conflictPenalty", conflictPenalty);
    }

    public static CombinerSettings defaults() {
        return new CombinerSettings(0.7, 0.3, 0.8, 1.0, 0.2, 0.3);
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0.0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
    }
}
