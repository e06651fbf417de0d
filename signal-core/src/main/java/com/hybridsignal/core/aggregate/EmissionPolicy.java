package com.hybridsignal.core.aggregate;

import com.hybridsignal.core.model.AggregatedSignal;

/**
 * Caller-side rule deciding whether an {@link AggregatedSignal} is actionable.
 * The aggregator itself never thresholds.
 */
public enum EmissionPolicy {

    /** More than half of the timeframes agree with the overall direction. */
    MAJORITY,

    /** Every timeframe must agree with the overall direction. */
    UNANIMOUS;

    public boolean isSatisfiedBy(AggregatedSignal aggregated) {
        if (aggregated == null || !aggregated.overallDirection().isDirectional()) {
            return false;
        }
        return switch (this) {
            case MAJORITY  -> aggregated.agreementRatio() > 0.5;
            case UNANIMOUS -> aggregated.isUnanimous();
        };
    }
}
