package com.hybridsignal.engine.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered timeframes, lowest first, each with an aggregation weight.
 *
 * <p>Parsed from {@code "1m:1,2m:2,5m:3,15m:4,30m:5,1h:6,4h:7"}; an entry without
 * {@code :weight} weighs 1.0. The next entry of a timeframe is its higher timeframe, used for
 * trend confirmation.
 */
public final class TimeframeHierarchy {

    private final List<String> timeframes;
    private final Map<String, Double> weights;

    private TimeframeHierarchy(Map<String, Double> ordered) {
        this.timeframes = List.copyOf(ordered.keySet());
        this.weights    = Collections.unmodifiableMap(new LinkedHashMap<>(ordered));
    }

    public static TimeframeHierarchy parse(String spec) {
        Map<String, Double> ordered = new LinkedHashMap<>();
        if (spec != null) {
            for (String part : spec.split(",")) {
                String entry = part.trim();
                if (entry.isEmpty()) continue;
                int colon = entry.indexOf(':');
                String timeframe = colon < 0 ? entry : entry.substring(0, colon).trim();
                double weight = 1.0;
                if (colon >= 0) {
                    try {
                        weight = Double.parseDouble(entry.substring(colon + 1).trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("invalid weight in timeframe entry '" + entry + "'", e);
                    }
                }
                if (ordered.putIfAbsent(timeframe, weight) != null) {
                    throw new IllegalArgumentException("timeframe '" + timeframe + "' listed twice");
                }
            }
        }
        return new TimeframeHierarchy(ordered);
    }

    public Map<String, Double> weights() {
        return weights;
    }

    public Optional<String> higherOf(String timeframe) {
        int idx = timeframes.indexOf(timeframe);
        if (idx < 0 || idx == timeframes.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(timeframes.get(idx + 1));
    }

    /** Position in the hierarchy; unknown timeframes sort after every known one. */
    private int rank(String timeframe) {
        int idx = timeframes.indexOf(timeframe);
        return idx < 0 ? Integer.MAX_VALUE : idx;
    }

    /** Copy of {@code input} sorted lowest timeframe first, unknown ones last in input order. */
    public List<String> sort(List<String> input) {
        List<String> sorted = new ArrayList<>(input);
        sorted.sort((a, b) -> Integer.compare(rank(a), rank(b)));
        return sorted;
    }
}
