package com.hybridsignal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Already-computed indicator scalars for one (instrument, timeframe, timestamp).
 *
 * <p>Produced by the external indicator layer; the engine only reads it. Missing scalars are
 * absent from {@link #values()} or carried as {@code null} / NaN; evaluators degrade those to a
 * NEUTRAL signal instead of throwing.
 */
public record IndicatorReading(
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("values") Map<String, Double> values
) {

    // trend stack
    public static final String CLOSE    = "close";
    public static final String MA_FAST  = "m1";
    public static final String MA_MID   = "m2";
    public static final String MA_SLOW  = "m3";
    public static final String MA_LONG  = "ma144";

    // timing triplet
    public static final String MACD_LINE   = "macd";
    public static final String MACD_SIGNAL = "signal";
    public static final String HISTOGRAM   = "histogram";

    public IndicatorReading {
        values = values == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static IndicatorReading of(String instrumentId, String timeframe, Instant timestamp,
                                      Map<String, Double> values) {
        return new IndicatorReading(instrumentId, timeframe, timestamp, values);
    }

    /** Raw scalar, or {@code null} when absent. */
    public Double value(String name) {
        return values.get(name);
    }

    /** True when the scalar is present and finite. */
    public boolean has(String name) {
        return Scores.isFinite(values.get(name));
    }

    /**
     * Returns a reading holding the union of both value maps; {@code other} wins on key clashes
     * and its timestamp is kept when it is later.
     */
    public IndicatorReading mergedWith(IndicatorReading other) {
        Map<String, Double> merged = new LinkedHashMap<>(values);
        merged.putAll(other.values());
        Instant ts = timestamp;
        if (ts == null || (other.timestamp() != null && other.timestamp().isAfter(ts))) {
            ts = other.timestamp();
        }
        return new IndicatorReading(instrumentId, timeframe, ts, merged);
    }
}
