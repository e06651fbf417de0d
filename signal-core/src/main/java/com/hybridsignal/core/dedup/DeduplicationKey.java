package com.hybridsignal.core.dedup;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hybridsignal.core.model.SignalType;

import java.util.Objects;

/** Identity of a notification: the same instrument, signal type and timeframe. */
public record DeduplicationKey(
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("signalType") SignalType signalType,
    @JsonProperty("timeframe") String timeframe
) {

    public DeduplicationKey {
        Objects.requireNonNull(instrumentId, "instrumentId");
        Objects.requireNonNull(signalType, "signalType");
        Objects.requireNonNull(timeframe, "timeframe");
    }

    public static DeduplicationKey of(String instrumentId, SignalType signalType, String timeframe) {
        return new DeduplicationKey(instrumentId, signalType, timeframe);
    }

    @Override
    public String toString() {
        return instrumentId + "_" + signalType + "_" + timeframe;
    }
}
