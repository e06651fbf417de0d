package com.hybridsignal.core.evaluator;

import com.hybridsignal.core.model.IndicatorKind;
import com.hybridsignal.core.model.IndicatorReading;
import com.hybridsignal.core.model.Signal;

/**
 * Turns one {@link IndicatorReading} into a per-indicator {@link Signal}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Total</b>    : a missing or non-finite scalar yields a NEUTRAL, zero-strength signal
 *       naming the field; they never throw for bad readings</li>
 * </ul>
 *
 * <p>The set of implementations is closed and keyed by {@link IndicatorKind}:
 * {@link TrendEvaluator}, {@link TimingEvaluator}, {@link MomentumEvaluator}.
 */
public interface IndicatorSignalEvaluator {

    IndicatorKind kind();

    Signal evaluate(IndicatorReading reading);
}
