package com.hybridsignal.core.evaluator;

import com.hybridsignal.core.model.Direction;
import com.hybridsignal.core.model.IndicatorKind;
import com.hybridsignal.core.model.IndicatorReading;
import com.hybridsignal.core.model.Scores;
import com.hybridsignal.core.model.Signal;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moving-average stack evaluator.
 *
 * <h3>Structure</h3>
 * <pre>
 *   bullish stack  : price &gt; m1 &gt; m2 &gt; m3
 *   local bullish  : bullish stack AND mean(m1, m2, m3) &gt; maLong
 *   bearish stack  : price &lt; m1 &lt; m2 &lt; m3
 *   local bearish  : bearish stack AND mean(m1, m2, m3) &lt; maLong
 * </pre>
 * A stack that fails the long-average filter is reported in the details but stays NEUTRAL.
 *
 * <h3>Confirmation</h3>
 * Whether the higher timeframe holds the same local condition is decided by the caller and
 * passed in as a {@code Boolean}. In {@link Mode#CONFIRMED} a {@code false} confirmation
 * neutralizes the signal; {@code null} means no higher timeframe is available and the local
 * result stands.
 *
 * <h3>Strength</h3>
 * <pre>
 *   strength = clamp(|price − maLong| / |maLong| / normalizationSpread, 0, 1)
 * </pre>
 * NEUTRAL results carry strength 0.0.
 */
public class TrendEvaluator implements IndicatorSignalEvaluator {

    public enum Mode { LOCAL, CONFIRMED }

    /** Shape of the average stack, before confirmation is applied. */
    public enum Structure {
        LOCAL_BULLISH(Direction.BUY),
        BULLISH_STACK(Direction.NEUTRAL),
        LOCAL_BEARISH(Direction.SELL),
        BEARISH_STACK(Direction.NEUTRAL),
        NONE(Direction.NEUTRAL);

        private final Direction direction;

        Structure(Direction direction) {
            this.direction = direction;
        }

        public Direction direction() {
            return direction;
        }
    }

    private static final String SOURCE = IndicatorKind.TREND.sourceName();

    private final TrendSettings settings;

    public TrendEvaluator(TrendSettings settings) {
        this.settings = settings;
    }

    public TrendEvaluator() {
        this(TrendSettings.defaults());
    }

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.TREND;
    }

    @Override
    public Signal evaluate(IndicatorReading reading) {
        return evaluate(reading, null);
    }

    /**
     * @param reading                  must carry close, m1, m2, m3 and ma144
     * @param higherTimeframeConfirmed caller's verdict on the higher timeframe; {@code null} when
     *                                 there is none
     */
    public Signal evaluate(IndicatorReading reading, Boolean higherTimeframeConfirmed) {
        return MissingFields.check(reading, SOURCE,
                IndicatorReading.CLOSE, IndicatorReading.MA_FAST, IndicatorReading.MA_MID,
                IndicatorReading.MA_SLOW, IndicatorReading.MA_LONG)
            .orElseGet(() -> evaluate(reading.instrumentId(), reading.timeframe(), reading.timestamp(),
                reading.value(IndicatorReading.CLOSE),
                reading.value(IndicatorReading.MA_FAST),
                reading.value(IndicatorReading.MA_MID),
                reading.value(IndicatorReading.MA_SLOW),
                reading.value(IndicatorReading.MA_LONG),
                higherTimeframeConfirmed));
    }

    /** Unkeyed variant for callers holding raw scalars. */
    public Signal evaluate(double price, double maShort1, double maShort2, double maShort3, double maLong) {
        if (!allFinite(price, maShort1, maShort2, maShort3, maLong)) {
            return Signal.neutral(null, null, SOURCE, "Missing or invalid trend scalar");
        }
        return evaluate(null, null, null, price, maShort1, maShort2, maShort3, maLong, null);
    }

    /**
     * Local direction of a reading, ignoring confirmation. Callers use it on the higher
     * timeframe to compute the confirmation flag. Incomplete readings are NEUTRAL.
     */
    public Direction localDirection(IndicatorReading reading) {
        if (MissingFields.check(reading, SOURCE,
                IndicatorReading.CLOSE, IndicatorReading.MA_FAST, IndicatorReading.MA_MID,
                IndicatorReading.MA_SLOW, IndicatorReading.MA_LONG).isPresent()) {
            return Direction.NEUTRAL;
        }
        return structure(
            reading.value(IndicatorReading.CLOSE),
            reading.value(IndicatorReading.MA_FAST),
            reading.value(IndicatorReading.MA_MID),
            reading.value(IndicatorReading.MA_SLOW),
            reading.value(IndicatorReading.MA_LONG)).direction();
    }

    public static Structure structure(double price, double m1, double m2, double m3, double maLong) {
        double mean = (m1 + m2 + m3) / 3.0;
        if (price > m1 && m1 > m2 && m2 > m3) {
            return mean > maLong ? Structure.LOCAL_BULLISH : Structure.BULLISH_STACK;
        }
        if (price < m1 && m1 < m2 && m2 < m3) {
            return mean < maLong ? Structure.LOCAL_BEARISH : Structure.BEARISH_STACK;
        }
        return Structure.NONE;
    }

    private Signal evaluate(String instrumentId, String timeframe, Instant timestamp,
                            double price, double m1, double m2, double m3, double maLong,
                            Boolean confirmed) {
        Structure structure = structure(price, m1, m2, m3, maLong);
        Direction direction = structure.direction();

        String rationale;
        if (!direction.isDirectional()) {
            rationale = "No local trend (" + structure + ")";
        } else if (settings.mode() == Mode.CONFIRMED && Boolean.FALSE.equals(confirmed)) {
            rationale = structure + " not confirmed by higher timeframe";
            direction = Direction.NEUTRAL;
        } else if (settings.mode() == Mode.CONFIRMED && Boolean.TRUE.equals(confirmed)) {
            rationale = structure + " confirmed by higher timeframe";
        } else {
            rationale = structure.toString();
        }

        double strength = direction.isDirectional() ? spreadStrength(price, maLong) : 0.0;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("structure", structure.name());
        details.put("close", price);
        details.put("m1", m1);
        details.put("m2", m2);
        details.put("m3", m3);
        details.put("maLong", maLong);
        details.put("shortMean", (m1 + m2 + m3) / 3.0);
        details.put("mode", settings.mode().name());
        details.put("higherTimeframeConfirmed", confirmed == null ? "N/A" : confirmed);

        return Signal.of(instrumentId, timeframe, SOURCE, direction, strength, rationale, timestamp, details);
    }

    private double spreadStrength(double price, double maLong) {
        if (maLong == 0.0) {
            return 0.0;
        }
        double spread = Math.abs(price - maLong) / Math.abs(maLong);
        return Scores.clamp01(spread / settings.normalizationSpread());
    }

    private static boolean allFinite(double... values) {
        for (double v : values) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                return false;
            }
        }
        return true;
    }
}
