package com.hybridsignal.core.evaluator;

import com.hybridsignal.core.model.Direction;
import com.hybridsignal.core.model.IndicatorKind;
import com.hybridsignal.core.model.IndicatorReading;
import com.hybridsignal.core.model.Scores;
import com.hybridsignal.core.model.Signal;
import com.hybridsignal.core.zone.ZoneThresholdMatcher;
import com.hybridsignal.core.zone.ZoneThresholdMatcher.ZoneMatch;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Oscillator-triplet evaluator (line, signal line, histogram).
 *
 * <p>Each scalar is classified independently by the {@link ZoneThresholdMatcher} against the
 * indicator names {@value #LINE}, {@value #SIGNAL} and {@value #HISTOGRAM}.
 *
 * <h3>Direction</h3>
 * <pre>
 *   ≥ 2 zones above neutral → BUY
 *   ≥ 2 zones below neutral → SELL
 *   otherwise               → NEUTRAL
 * </pre>
 *
 * <h3>Strength</h3>
 * Weighted mean of the three zone intensities (see {@link TimingSettings}), clamped to [0, 1].
 * It is reported for NEUTRAL results too, so a combiner can see how close to a call the
 * oscillator was.
 */
public class TimingEvaluator implements IndicatorSignalEvaluator {

    public static final String LINE      = "line";
    public static final String SIGNAL    = "signal";
    public static final String HISTOGRAM = "histogram";

    private static final String SOURCE = IndicatorKind.TIMING.sourceName();

    private final ZoneThresholdMatcher matcher;
    private final TimingSettings settings;

    public TimingEvaluator(ZoneThresholdMatcher matcher, TimingSettings settings) {
        this.matcher  = matcher;
        this.settings = settings;
    }

    public TimingEvaluator(ZoneThresholdMatcher matcher) {
        this(matcher, TimingSettings.defaults());
    }

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.TIMING;
    }

    @Override
    public Signal evaluate(IndicatorReading reading) {
        return MissingFields.check(reading, SOURCE,
                IndicatorReading.MACD_LINE, IndicatorReading.MACD_SIGNAL, IndicatorReading.HISTOGRAM)
            .orElseGet(() -> evaluate(
                reading.value(IndicatorReading.MACD_LINE),
                reading.value(IndicatorReading.MACD_SIGNAL),
                reading.value(IndicatorReading.HISTOGRAM),
                reading.instrumentId(), reading.timeframe(), reading.timestamp()));
    }

    public Signal evaluate(double lineValue, double signalValue, double histogramValue,
                           String instrumentId, String timeframe) {
        return evaluate(lineValue, signalValue, histogramValue, instrumentId, timeframe, null);
    }

    private Signal evaluate(double lineValue, double signalValue, double histogramValue,
                            String instrumentId, String timeframe, Instant timestamp) {
        if (Double.isNaN(lineValue) || Double.isNaN(signalValue) || Double.isNaN(histogramValue)) {
            return Signal.neutral(instrumentId, timeframe, SOURCE, "Missing or invalid timing scalar");
        }

        ZoneMatch line      = matcher.classify(instrumentId, timeframe, LINE, lineValue);
        ZoneMatch signal    = matcher.classify(instrumentId, timeframe, SIGNAL, signalValue);
        ZoneMatch histogram = matcher.classify(instrumentId, timeframe, HISTOGRAM, histogramValue);

        int bullish = 0;
        int bearish = 0;
        for (ZoneMatch m : List.of(line, signal, histogram)) {
            if (m.polarity() == Direction.BUY)  bullish++;
            if (m.polarity() == Direction.SELL) bearish++;
        }

        Direction direction;
        if (bullish >= 2)      direction = Direction.BUY;
        else if (bearish >= 2) direction = Direction.SELL;
        else                   direction = Direction.NEUTRAL;

        double strength = Scores.clamp01(
            (line.intensity()      * settings.lineWeight()
           + signal.intensity()    * settings.signalWeight()
           + histogram.intensity() * settings.histogramWeight()) / settings.total());

        String rationale = String.format("zones line=%s signal=%s histogram=%s (%d bullish, %d bearish)",
            line.zone(), signal.zone(), histogram.zone(), bullish, bearish);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("line", lineValue);
        details.put("signal", signalValue);
        details.put("histogram", histogramValue);
        details.put("lineZone", line.zone());
        details.put("signalZone", signal.zone());
        details.put("histogramZone", histogram.zone());

        return Signal.of(instrumentId, timeframe, SOURCE, direction, strength, rationale, timestamp, details);
    }
}
