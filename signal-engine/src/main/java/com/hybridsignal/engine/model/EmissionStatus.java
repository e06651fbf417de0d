package com.hybridsignal.engine.model;

public enum EmissionStatus {
    /** At least one timeframe signal was recorded and notified. */
    EMITTED,
    /** The gate passed but every candidate was a duplicate inside the TTL window. */
    SUPPRESSED,
    /** Policy or minimum confidence not met. */
    BELOW_THRESHOLD,
    /** Nothing to evaluate for the instrument. */
    NO_READINGS
}
