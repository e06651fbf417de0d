package com.hybridsignal.core.evaluator;

import com.hybridsignal.core.model.Direction;
import com.hybridsignal.core.model.IndicatorKind;
import com.hybridsignal.core.model.IndicatorReading;
import com.hybridsignal.core.model.Signal;
import com.hybridsignal.core.zone.ZoneThresholdMatcher;
import com.hybridsignal.core.zone.ZoneThresholdMatcher.ZoneMatch;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Histogram-only momentum vote.
 *
 * <p>{@code abs(histogram)} is classified against the {@value #BARS} zone set, so that set is
 * configured as magnitude tiers. Direction comes from the histogram's sign:
 * <pre>
 *   histogram &gt; 0 and zone not neutral → BUY
 *   histogram &lt; 0 and zone not neutral → SELL
 *   otherwise                           → NEUTRAL
 * </pre>
 * Strength is the zone's intensity on the scale; 0.0 when NEUTRAL.
 */
public class MomentumEvaluator implements IndicatorSignalEvaluator {

    public static final String BARS = "bars";

    private static final String SOURCE = IndicatorKind.MOMENTUM.sourceName();

    private final ZoneThresholdMatcher matcher;

    public MomentumEvaluator(ZoneThresholdMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.MOMENTUM;
    }

    @Override
    public Signal evaluate(IndicatorReading reading) {
        return MissingFields.check(reading, SOURCE, IndicatorReading.HISTOGRAM)
            .orElseGet(() -> evaluate(reading.value(IndicatorReading.HISTOGRAM),
                                      reading.instrumentId(), reading.timeframe(), reading.timestamp()));
    }

    public Signal evaluate(double histogramValue, String instrumentId, String timeframe) {
        return evaluate(histogramValue, instrumentId, timeframe, null);
    }

    private Signal evaluate(double histogramValue, String instrumentId, String timeframe, Instant timestamp) {
        if (Double.isNaN(histogramValue)) {
            return Signal.neutral(instrumentId, timeframe, SOURCE, "Missing or invalid histogram");
        }
        ZoneMatch bars = matcher.classify(instrumentId, timeframe, BARS, Math.abs(histogramValue));

        Direction direction = Direction.NEUTRAL;
        if (!bars.isNeutral()) {
            if (histogramValue > 0)      direction = Direction.BUY;
            else if (histogramValue < 0) direction = Direction.SELL;
        }
        double strength = direction.isDirectional() ? bars.intensity() : 0.0;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("histogram", histogramValue);
        details.put("barsZone", bars.zone());

        String rationale = "bars zone=" + bars.zone() + " histogram=" + histogramValue;
        return Signal.of(instrumentId, timeframe, SOURCE, direction, strength, rationale, timestamp, details);
    }
}
