package com.hybridsignal.core.aggregate;

import com.hybridsignal.core.model.AggregatedSignal;

/**
 * Emission rule applied after aggregation and before deduplication: the
 * {@link EmissionPolicy} must hold and the overall confidence must reach
 * {@code minConfidence}.
 */
public record EmissionGate(EmissionPolicy policy, double minConfidence) {

    public EmissionGate {
        if (policy == null) {
            policy = EmissionPolicy.MAJORITY;
        }
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be in [0, 1], got " + minConfidence);
        }
    }

    public static EmissionGate majority() {
        return new EmissionGate(EmissionPolicy.MAJORITY, 0.0);
    }

    public boolean allows(AggregatedSignal aggregated) {
        return policy.isSatisfiedBy(aggregated) && aggregated.overallConfidence() >= minConfidence;
    }
}
