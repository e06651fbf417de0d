package com.hybridsignal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable output of an evaluator, the combiner, or the emission gate.
 *
 * <p>The same shape is used for per-indicator signals ({@code source} = "trend", "timing",
 * "momentum") and for hybrid signals ({@code source} = "hybrid"), whose
 * {@link #components()} hold the per-indicator inputs that produced them.
 *
 * <p>Invariants enforced on construction:
 * <ul>
 *   <li>{@code direction == signalType.direction()}</li>
 *   <li>{@code strength} and {@code confidence} are clamped to [0.0, 1.0]</li>
 *   <li>{@code components} and {@code details} are unmodifiable snapshots</li>
 * </ul>
 */
public record Signal(
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("source") String source,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("signalType") SignalType signalType,
    @JsonProperty("strength") double strength,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("components") List<Signal> components,
    @JsonProperty("details") Map<String, Object> details
) {

    public static final String HYBRID_SOURCE = "hybrid";

    public Signal {
        if (signalType == null) {
            signalType = SignalType.of(direction == null ? Direction.NEUTRAL : direction);
        }
        if (direction == null) {
            direction = signalType.direction();
        }
        if (direction != signalType.direction()) {
            throw new IllegalArgumentException(
                "direction " + direction + " does not match signalType " + signalType);
        }
        strength   = Scores.clamp01(strength);
        confidence = Scores.clamp01(confidence);
        rationale  = rationale == null ? "" : rationale;
        components = components == null ? List.of() : List.copyOf(components);
        details    = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Per-indicator signal whose type is the plain projection of {@code direction} and whose
     * confidence equals its strength.
     */
    public static Signal of(String instrumentId, String timeframe, String source,
                            Direction direction, double strength, String rationale,
                            Instant timestamp, Map<String, Object> details) {
        return new Signal(instrumentId, timeframe, source, direction, SignalType.of(direction),
                          strength, strength, rationale, timestamp, List.of(), details);
    }

    /** NEUTRAL, zero-strength signal explaining why nothing could be evaluated. */
    public static Signal neutral(String instrumentId, String timeframe, String source, String reason) {
        return new Signal(instrumentId, timeframe, source, Direction.NEUTRAL, SignalType.NEUTRAL,
                          0.0, 0.0, reason, null, List.of(), Map.of("reason", reason));
    }

    public boolean isDirectional() {
        return direction.isDirectional();
    }
}
