package com.hybridsignal.core.aggregate;

import com.hybridsignal.core.model.AggregatedSignal;
import com.hybridsignal.core.model.Direction;
import com.hybridsignal.core.model.Scores;
import com.hybridsignal.core.model.Signal;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the hybrid signals of several timeframes of one instrument into an
 * {@link AggregatedSignal}.
 *
 * <h3>Algorithm</h3>
 * <pre>
 *   overallDirection  = plurality of BUY / SELL / NEUTRAL, tie at the top → NEUTRAL
 *   overallConfidence = mean(confidence)
 *   agreementRatio    = count(direction == overall) / total
 *   overallStrength   = Σ(weight(tf) × strength) / Σ weight(tf)   over signals matching overall
 *                       0.0 when overall is NEUTRAL
 * </pre>
 *
 * <p>Timeframes missing from the weight table weigh {@value #DEFAULT_WEIGHT}. The input
 * order is preserved in {@link AggregatedSignal#perTimeframe()}.
 */
public class TimeframeAggregator {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final Map<String, Double> timeframeWeights;

    public TimeframeAggregator(Map<String, Double> timeframeWeights) {
        this.timeframeWeights = timeframeWeights == null ? Map.of() : Map.copyOf(timeframeWeights);
    }

    public TimeframeAggregator() {
        this(Map.of());
    }

    public AggregatedSignal aggregate(List<Signal> signals) {
        String instrumentId = signals == null || signals.isEmpty() ? null : signals.get(0).instrumentId();
        return aggregate(instrumentId, signals);
    }

    public AggregatedSignal aggregate(String instrumentId, List<Signal> signals) {
        if (signals == null || signals.isEmpty()) {
            return new AggregatedSignal(instrumentId, Direction.NEUTRAL, 0.0, 0.0, List.of(), 0.0);
        }

        Map<Direction, Integer> votes = new EnumMap<>(Direction.class);
        double confidenceSum = 0.0;
        for (Signal s : signals) {
            votes.merge(s.direction(), 1, Integer::sum);
            confidenceSum += s.confidence();
        }

        Direction overall = plurality(votes);
        int matching = votes.getOrDefault(overall, 0);

        double weightedStrength = 0.0;
        double weightTotal = 0.0;
        if (overall.isDirectional()) {
            for (Signal s : signals) {
                if (s.direction() != overall) continue;
                double w = weight(s.timeframe());
                weightedStrength += w * s.strength();
                weightTotal += w;
            }
        }

        double overallStrength = weightTotal > 0.0 ? weightedStrength / weightTotal : 0.0;
        return new AggregatedSignal(
            instrumentId,
            overall,
            Scores.clamp01(confidenceSum / signals.size()),
            Scores.clamp01(overallStrength),
            signals,
            (double) matching / signals.size()
        );
    }

    public double weight(String timeframe) {
        if (timeframe == null) return DEFAULT_WEIGHT;
        Double w = timeframeWeights.get(timeframe);
        return w == null || w < 0.0 ? DEFAULT_WEIGHT : w;
    }

    // ── plurality ────────────────────────────────────────────────────────────

    private static Direction plurality(Map<Direction, Integer> votes) {
        Direction best = Direction.NEUTRAL;
        int bestCount = -1;
        boolean tied = false;
        for (Map.Entry<Direction, Integer> e : votes.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
                tied = false;
            } else if (e.getValue() == bestCount) {
                tied = true;
            }
        }
        return tied ? Direction.NEUTRAL : best;
    }
}
