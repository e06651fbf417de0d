package com.hybridsignal.core.combiner;

import com.hybridsignal.core.model.Direction;
import com.hybridsignal.core.model.Scores;
import com.hybridsignal.core.model.Signal;
import com.hybridsignal.core.model.SignalType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic algebra that merges per-indicator signals of one timeframe into a hybrid
 * {@link Signal}.
 *
 * <h3>Two indicators: {@link #combine(Signal, Signal)}</h3>
 * <pre>
 *   trend    timing   → type        strength
 *   BUY      BUY      → STRONG_BUY  min(t + m, 1.0)
 *   BUY      NEUTRAL  → BUY         t × 0.7
 *   NEUTRAL  BUY      → BUY         m × 0.7
 *   BUY      SELL     → WEAK_BUY    |t − m| × 0.3
 *   NEUTRAL  NEUTRAL  → NEUTRAL     0.0
 * </pre>
 * SELL rows are symmetric; on conflict the trend indicator sets the weak direction.
 *
 * <h3>Three indicators: {@link #combineThree(Signal, Signal, Signal)}</h3>
 * <pre>
 *   3 of 3 directional agree → STRONG_*   min(Σ, 1.0)
 *   2 of 3 directional agree → BUY / SELL (Σ / 3) × 0.8
 *       demoted to WEAK_*    when mean(majority) &lt; dissenter × weakMajorityRatio,
 *                            strength |mean(majority) − dissenter| × 0.3
 *   otherwise                → NEUTRAL    0.0
 * </pre>
 *
 * <h3>Confidence</h3>
 * <pre>
 *   confidence = strength
 *              + agreementBonus   (all participating votes directional and equal)
 *              − conflictPenalty  (two directional votes oppose)
 *   clamped to [0, 1]
 * </pre>
 *
 * <p>Constants above are the {@link CombinerSettings#defaults()}. Stateless and thread-safe;
 * inputs are never modified.
 */
public class SignalCombiner {

    private final CombinerSettings settings;

    public SignalCombiner(CombinerSettings settings) {
        this.settings = settings;
    }

    public SignalCombiner() {
        this(CombinerSettings.defaults());
    }

    public Signal combine(Signal trend, Signal timing) {
        Signal t = orNeutral(trend, "trend");
        Signal m = orNeutral(timing, "timing");
        Direction td = t.direction();
        Direction md = m.direction();

        SignalType type;
        double strength;
        String logic;

        if (td.isDirectional() && td == md) {
            type     = SignalType.strong(td);
            strength = Math.min(t.strength() + m.strength(), 1.0);
            logic    = "Both " + t.source() + " and " + m.source() + " " + lean(td);
        } else if (td.isDirectional() && !md.isDirectional()) {
            type     = SignalType.of(td);
            strength = t.strength() * settings.singleIndicatorFactor();
            logic    = capitalize(t.source()) + " " + lean(td) + ", " + m.source() + " neutral";
        } else if (!td.isDirectional() && md.isDirectional()) {
            type     = SignalType.of(md);
            strength = m.strength() * settings.singleIndicatorFactor();
            logic    = capitalize(m.source()) + " " + lean(md) + ", " + t.source() + " neutral";
        } else if (td.isDirectional()) {
            type     = SignalType.weak(td);
            strength = Math.abs(t.strength() - m.strength()) * settings.conflictFactor();
            logic    = capitalize(t.source()) + " " + lean(td) + ", " + m.source() + " " + lean(md) + " (conflict)";
        } else {
            type     = SignalType.NEUTRAL;
            strength = 0.0;
            logic    = "Both " + t.source() + " and " + m.source() + " neutral";
        }

        double confidence = confidence(strength, List.of(t, m));
        return hybrid(type, strength, confidence, logic, List.of(t, m));
    }

    public Signal combineThree(Signal trend, Signal timing, Signal momentum) {
        List<Signal> votes = List.of(
            orNeutral(trend, "trend"), orNeutral(timing, "timing"), orNeutral(momentum, "momentum"));

        int buy  = count(votes, Direction.BUY);
        int sell = count(votes, Direction.SELL);
        double sum = votes.stream().mapToDouble(Signal::strength).sum();

        SignalType type;
        double strength;
        String logic;

        Direction majority = buy >= 2 ? Direction.BUY : sell >= 2 ? Direction.SELL : Direction.NEUTRAL;

        if (majority.isDirectional() && count(votes, majority) == 3) {
            type     = SignalType.strong(majority);
            strength = Math.min(sum, 1.0);
            logic    = "All three indicators " + lean(majority);
        } else if (majority.isDirectional()) {
            Signal dissenter = null;
            double majoritySum = 0.0;
            for (Signal v : votes) {
                if (v.direction() == majority) majoritySum += v.strength();
                else dissenter = v;
            }
            double majorityMean = majoritySum / 2.0;
            Objects.requireNonNull(dissenter);
            if (majorityMean < dissenter.strength() * settings.weakMajorityRatio()) {
                type     = SignalType.weak(majority);
                strength = Math.abs(majorityMean - dissenter.strength()) * settings.conflictFactor();
                logic    = String.format("2 of 3 %s but outweighed by %s %s (%.2f vs %.2f)",
                    lean(majority), dissenter.source(), dissenter.direction(), majorityMean, dissenter.strength());
            } else {
                type     = SignalType.of(majority);
                strength = (sum / 3.0) * settings.majorityFactor();
                logic    = "2 of 3 " + lean(majority) + ", " + dissenter.source() + " " + dissenter.direction();
            }
        } else {
            type     = SignalType.NEUTRAL;
            strength = 0.0;
            logic    = String.format("No majority (%d buy, %d sell, %d neutral)", buy, sell, 3 - buy - sell);
        }

        double confidence = confidence(strength, votes);
        return hybrid(type, strength, confidence, logic, votes);
    }

    /** Dispatches on arity: two signals → {@link #combine}, three → {@link #combineThree}. */
    public Signal combineAll(List<Signal> signals) {
        return switch (signals.size()) {
            case 2  -> combine(signals.get(0), signals.get(1));
            case 3  -> combineThree(signals.get(0), signals.get(1), signals.get(2));
            default -> throw new IllegalArgumentException(
                "combiner accepts 2 or 3 signals, got " + signals.size());
        };
    }

    private double confidence(double strength, List<Signal> votes) {
        List<Direction> directional = new ArrayList<>();
        for (Signal v : votes) {
            if (v.isDirectional()) directional.add(v.direction());
        }
        boolean allAgree = directional.size() == votes.size()
            && directional.stream().distinct().count() == 1;
        boolean conflict = directional.contains(Direction.BUY) && directional.contains(Direction.SELL);

        double c = strength;
        if (allAgree) c += settings.agreementBonus();
        if (conflict) c -= settings.conflictPenalty();
        return Scores.clamp01(c);
    }

    private Signal hybrid(SignalType type, double strength, double confidence, String logic, List<Signal> parts) {
        String instrumentId = null;
        String timeframe    = null;
        Instant timestamp   = null;
        Map<String, Object> details = new LinkedHashMap<>();
        for (Signal p : parts) {
            if (instrumentId == null) instrumentId = p.instrumentId();
            if (timeframe == null)    timeframe    = p.timeframe();
            if (p.timestamp() != null && (timestamp == null || p.timestamp().isAfter(timestamp))) {
                timestamp = p.timestamp();
            }
            details.put(p.source() + "Direction", p.direction().name());
            details.put(p.source() + "Strength", p.strength());
        }
        details.put("logic", logic);
        return new Signal(instrumentId, timeframe, Signal.HYBRID_SOURCE, type.direction(), type,
                          strength, confidence, logic, timestamp, parts, details);
    }

    private static Signal orNeutral(Signal s, String source) {
        return s != null ? s : Signal.neutral(null, null, source, "No " + source + " signal");
    }

    private static int count(List<Signal> votes, Direction d) {
        int n = 0;
        for (Signal v : votes) {
            if (v.direction() == d) n++;
        }
        return n;
    }

    private static String lean(Direction d) {
        return switch (d) {
            case BUY  -> "bullish";
            case SELL -> "bearish";
            default   -> "neutral";
        };
    }

    private static String capitalize(String s) {
        return s == null || s.isEmpty() ? "" : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
