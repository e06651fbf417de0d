package com.hybridsignal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Cross-timeframe merge of per-timeframe hybrid signals for one instrument.
 *
 * <ul>
 *   <li>{@code overallDirection} : plurality vote, ties resolved to NEUTRAL</li>
 *   <li>{@code overallConfidence}: arithmetic mean of per-timeframe confidences</li>
 *   <li>{@code overallStrength}  : timeframe-weighted mean strength of the signals that
 *       agree with {@code overallDirection}; 0.0 when NEUTRAL</li>
 *   <li>{@code agreementRatio}   : share of timeframes matching {@code overallDirection}</li>
 * </ul>
 *
 * <p>Derived only; never persisted by the core.
 */
public record AggregatedSignal(
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("overallDirection") Direction overallDirection,
    @JsonProperty("overallConfidence") double overallConfidence,
    @JsonProperty("overallStrength") double overallStrength,
    @JsonProperty("perTimeframe") List<Signal> perTimeframe,
    @JsonProperty("agreementRatio") double agreementRatio
) {

    public AggregatedSignal {
        perTimeframe = perTimeframe == null ? List.of() : List.copyOf(perTimeframe);
    }

    public boolean isUnanimous() {
        return !perTimeframe.isEmpty() && agreementRatio >= 1.0;
    }
}
