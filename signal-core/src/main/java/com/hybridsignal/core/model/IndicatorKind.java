package com.hybridsignal.core.model;

/**
 * Closed set of indicator families the engine knows how to evaluate.
 */
public enum IndicatorKind {

    /** Moving-average stack: close, three short averages, one long average. */
    TREND("trend"),

    /** Oscillator triplet: line, signal line, histogram. */
    TIMING("timing"),

    /** Histogram magnitude against the "bars" zone set. */
    MOMENTUM("momentum");

    private final String sourceName;

    IndicatorKind(String sourceName) {
        this.sourceName = sourceName;
    }

    /** Name written into {@link Signal#source()} for signals of this kind. */
    public String sourceName() {
        return sourceName;
    }
}
