package com.hybridsignal.core.zone;

import com.hybridsignal.core.model.Direction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Classifies a scalar indicator value into a named zone.
 *
 * <h3>Lookup chain</h3>
 * <ol>
 *   <li>rows configured for (instrument, timeframe, indicator)</li>
 *   <li>market template rows for the instrument's market classification</li>
 *   <li>{@value ZoneScale#NEUTRAL} sentinel</li>
 * </ol>
 *
 * <h3>Tie-break</h3>
 * Rows are tried in {@link ZoneScale#evaluationOrder()} (most extreme first) and the first
 * satisfied predicate wins. A value no row accepts, NaN included, is {@value ZoneScale#NEUTRAL}.
 *
 * <p>Pure and thread-safe; never throws for missing configuration.
 */
public class ZoneThresholdMatcher {

    private final ThresholdSource source;

    public ZoneThresholdMatcher(ThresholdSource source) {
        this.source = source;
    }

    public String match(String instrumentId, String timeframe, String indicatorName, double value) {
        if (Double.isNaN(value)) {
            return ZoneScale.NEUTRAL;
        }
        List<ZoneThreshold> rows = resolve(instrumentId, timeframe, indicatorName);
        if (rows.isEmpty()) {
            return ZoneScale.NEUTRAL;
        }
        for (ZoneThreshold row : inEvaluationOrder(rows)) {
            if (row.matches(value)) {
                return row.zoneName();
            }
        }
        return ZoneScale.NEUTRAL;
    }

    /** Zone plus its polarity and intensity on the configured scale. */
    public ZoneMatch classify(String instrumentId, String timeframe, String indicatorName, double value) {
        String zone = match(instrumentId, timeframe, indicatorName, value);
        ZoneScale scale = source.scale();
        return new ZoneMatch(indicatorName, zone, scale.polarity(zone), scale.intensity(zone));
    }

    private List<ZoneThreshold> resolve(String instrumentId, String timeframe, String indicatorName) {
        List<ZoneThreshold> rows = source.instrumentThresholds(instrumentId, timeframe, indicatorName);
        if (!rows.isEmpty()) {
            return rows;
        }
        Optional<String> market = source.marketOf(instrumentId);
        return market
            .map(m -> source.marketThresholds(m, timeframe, indicatorName))
            .orElse(List.of());
    }

    private List<ZoneThreshold> inEvaluationOrder(List<ZoneThreshold> rows) {
        ZoneScale scale = source.scale();
        List<ZoneThreshold> ordered = new ArrayList<>(rows);
        ordered.sort(Comparator.comparingInt(r -> scale.priority(r.zoneName())));
        return ordered;
    }

    /**
     * Result of {@link #classify}. {@code intensity} is the zone's distance from neutral on the
     * scale, normalized to [0, 1].
     */
    public record ZoneMatch(String indicatorName, String zone, Direction polarity, double intensity) {

        public boolean isNeutral() {
            return polarity == Direction.NEUTRAL;
        }
    }
}
