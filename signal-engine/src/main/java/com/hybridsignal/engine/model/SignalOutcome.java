package com.hybridsignal.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hybridsignal.core.model.AggregatedSignal;
import com.hybridsignal.core.model.Signal;

import java.util.List;

/**
 * Result of one {@code HybridSignalService.evaluate} run.
 *
 * <p>{@code emitted} signals went to the recorder and notifier; {@code suppressed} ones agreed
 * with the overall direction but were deduplicated.
 */
public record SignalOutcome(
    @JsonProperty("evaluationId") String evaluationId,
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("aggregated") AggregatedSignal aggregated,
    @JsonProperty("status") EmissionStatus status,
    @JsonProperty("emitted") List<Signal> emitted,
    @JsonProperty("suppressed") List<Signal> suppressed
) {

    public SignalOutcome {
        emitted    = emitted == null ? List.of() : List.copyOf(emitted);
        suppressed = suppressed == null ? List.of() : List.copyOf(suppressed);
    }

    public static SignalOutcome of(String evaluationId, AggregatedSignal aggregated, EmissionStatus status,
                                   List<Signal> emitted, List<Signal> suppressed) {
        return new SignalOutcome(evaluationId, aggregated.instrumentId(), aggregated, status, emitted, suppressed);
    }
}
