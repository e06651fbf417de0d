package com.hybridsignal.core.evaluator;

import com.hybridsignal.core.model.IndicatorReading;
import com.hybridsignal.core.model.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared guard that turns an incomplete reading into a NEUTRAL signal.
 */
final class MissingFields {

    private MissingFields() {}

    static Optional<Signal> check(IndicatorReading reading, String source, String... required) {
        if (reading == null) {
            return Optional.of(Signal.neutral(null, null, source, "No reading supplied"));
        }
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            if (!reading.has(field)) {
                missing.add(field);
            }
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Signal.neutral(reading.instrumentId(), reading.timeframe(), source,
                                          "Missing or invalid field(s): " + String.join(", ", missing)));
    }
}
