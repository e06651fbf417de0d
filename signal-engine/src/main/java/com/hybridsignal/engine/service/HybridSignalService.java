package com.hybridsignal.engine.service;

import com.hybridsignal.core.aggregate.EmissionGate;
import com.hybridsignal.core.aggregate.TimeframeAggregator;
import com.hybridsignal.core.combiner.SignalCombiner;
import com.hybridsignal.core.dedup.DeduplicationCache;
import com.hybridsignal.core.evaluator.MomentumEvaluator;
import com.hybridsignal.core.evaluator.TimingEvaluator;
import com.hybridsignal.core.evaluator.TrendEvaluator;
import com.hybridsignal.core.model.AggregatedSignal;
import com.hybridsignal.core.model.Direction;
import com.hybridsignal.core.model.IndicatorReading;
import com.hybridsignal.core.model.Signal;
import com.hybridsignal.core.publish.SignalNotifier;
import com.hybridsignal.core.publish.SignalRecorder;
import com.hybridsignal.engine.logger.SignalFlowLogger;
import com.hybridsignal.engine.model.EmissionStatus;
import com.hybridsignal.engine.model.SignalOutcome;
import com.hybridsignal.engine.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluate → aggregate → gate → publish pipeline for one instrument.
 *
 * <ol>
 *   <li>readings are merged per timeframe and ordered by the {@link TimeframeHierarchy}</li>
 *   <li>each timeframe is evaluated in parallel; a failing timeframe degrades to a NEUTRAL
 *       hybrid signal instead of failing the run</li>
 *   <li>the hybrid signals are aggregated and checked against the {@link EmissionGate}</li>
 *   <li>every timeframe signal agreeing with the overall direction goes through the
 *       {@link DeduplicationCache}; survivors are recorded and notified</li>
 * </ol>
 */
@Service
public class HybridSignalService {

    private static final Logger log = LoggerFactory.getLogger(HybridSignalService.class);

    private final TrendEvaluator trendEvaluator;
    private final TimingEvaluator timingEvaluator;
    private final MomentumEvaluator momentumEvaluator;
    private final SignalCombiner combiner;
    private final TimeframeAggregator aggregator;
    private final TimeframeHierarchy hierarchy;
    private final EmissionGate emissionGate;
    private final DeduplicationCache deduplicationCache;
    private final SignalRecorder recorder;
    private final SignalNotifier notifier;
    private final SignalFlowLogger flowLogger;
    private final boolean momentumEnabled;

    public HybridSignalService(TrendEvaluator trendEvaluator,
                               TimingEvaluator timingEvaluator,
                               MomentumEvaluator momentumEvaluator,
                               SignalCombiner combiner,
                               TimeframeAggregator aggregator,
                               TimeframeHierarchy hierarchy,
                               EmissionGate emissionGate,
                               DeduplicationCache deduplicationCache,
                               SignalRecorder recorder,
                               SignalNotifier notifier,
                               SignalFlowLogger flowLogger,
                               @Value("${signal-engine.momentum.enabled:false}") boolean momentumEnabled) {
        this.trendEvaluator     = trendEvaluator;
        this.timingEvaluator    = timingEvaluator;
        this.momentumEvaluator  = momentumEvaluator;
        this.combiner           = combiner;
        this.aggregator         = aggregator;
        this.hierarchy          = hierarchy;
        this.emissionGate       = emissionGate;
        this.deduplicationCache = deduplicationCache;
        this.recorder           = recorder;
        this.notifier           = notifier;
        this.flowLogger         = flowLogger;
        this.momentumEnabled    = momentumEnabled;
    }

    public Mono<SignalOutcome> evaluate(String instrumentId, List<IndicatorReading> readings) {
        Objects.requireNonNull(instrumentId, "instrumentId");
        String evaluationId = TraceContextUtil.newEvaluationId(instrumentId);

        Mono<SignalOutcome> pipeline = Mono.fromCallable(() -> mergeByTimeframe(instrumentId, readings))
            .doOnEach(flowLogger.stage(SignalFlowLogger.READINGS_RECEIVED))
            .flatMap(byTimeframe -> Flux.fromIterable(byTimeframe.keySet())
                .flatMapSequential(tf -> dispatchTimeframe(instrumentId, tf, byTimeframe))
                .collectList())
            .doOnEach(flowLogger.stage(SignalFlowLogger.TIMEFRAMES_EVALUATED))
            .map(signals -> aggregator.aggregate(instrumentId, signals))
            .doOnNext(aggregated -> flowLogger.logAggregate(aggregated, evaluationId))
            .map(aggregated -> gateAndDispatch(evaluationId, aggregated))
            .doOnEach(flowLogger.stage(SignalFlowLogger.EMISSION_GATED));

        return TraceContextUtil.withEvaluation(pipeline, evaluationId, instrumentId);
    }

    /**
     * Hybrid signal of one timeframe, synchronously. Trend confirmation looks only at the
     * immediate successor of {@code timeframe} in the hierarchy; when {@code byTimeframe} has no
     * reading for it, the trend is evaluated unconfirmed.
     */
    public Signal evaluateTimeframe(String timeframe, Map<String, IndicatorReading> byTimeframe) {
        IndicatorReading reading = byTimeframe.get(timeframe);
        Signal trend  = trendEvaluator.evaluate(reading, confirmation(timeframe, reading, byTimeframe));
        Signal timing = timingEvaluator.evaluate(reading);
        if (momentumEnabled) {
            return combiner.combineThree(trend, timing, momentumEvaluator.evaluate(reading));
        }
        return combiner.combine(trend, timing);
    }

    // ── stage 1: per-timeframe evaluation ───────────────────────────────────

    private Mono<Signal> dispatchTimeframe(String instrumentId, String timeframe,
                                           Map<String, IndicatorReading> byTimeframe) {
        return Mono.fromCallable(() -> evaluateTimeframe(timeframe, byTimeframe))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(s -> log.info("Timeframe={} complete. instrument={} type={} strength={} confidence={}",
                timeframe, instrumentId, s.signalType(),
                String.format("%.3f", s.strength()), String.format("%.3f", s.confidence())))
            .onErrorResume(e -> {
                log.error("Timeframe={} failed for instrument={}", timeframe, instrumentId, e);
                return Mono.just(Signal.neutral(instrumentId, timeframe, Signal.HYBRID_SOURCE,
                    "Evaluation failed: " + e.getMessage()));
            });
    }

    private Boolean confirmation(String timeframe, IndicatorReading reading,
                                 Map<String, IndicatorReading> byTimeframe) {
        Optional<String> higher = hierarchy.higherOf(timeframe);
        if (higher.isEmpty() || !byTimeframe.containsKey(higher.get())) {
            return null;
        }
        Direction local = trendEvaluator.localDirection(reading);
        Direction upper = trendEvaluator.localDirection(byTimeframe.get(higher.get()));
        return local.isDirectional() && local == upper;
    }

    /** Readings of {@code instrumentId} merged per timeframe, lowest timeframe first. */
    Map<String, IndicatorReading> mergeByTimeframe(String instrumentId, List<IndicatorReading> readings) {
        Map<String, IndicatorReading> merged = new LinkedHashMap<>();
        if (readings == null) {
            return merged;
        }
        for (IndicatorReading r : readings) {
            if (r == null || r.timeframe() == null) {
                log.warn("Skipping reading without timeframe for instrument={}", instrumentId);
                continue;
            }
            if (r.instrumentId() != null && !instrumentId.equals(r.instrumentId())) {
                log.warn("Skipping reading of instrument={} in evaluation of instrument={}",
                         r.instrumentId(), instrumentId);
                continue;
            }
            IndicatorReading normalized = r.instrumentId() == null
                ? IndicatorReading.of(instrumentId, r.timeframe(), r.timestamp(), r.values())
                : r;
            merged.merge(r.timeframe(), normalized, IndicatorReading::mergedWith);
        }
        Map<String, IndicatorReading> ordered = new LinkedHashMap<>();
        for (String tf : hierarchy.sort(new ArrayList<>(merged.keySet()))) {
            ordered.put(tf, merged.get(tf));
        }
        return ordered;
    }

    // ── stages 2 and 3: gate and publish ────────────────────────────────────

    private SignalOutcome gateAndDispatch(String evaluationId, AggregatedSignal aggregated) {
        if (aggregated.perTimeframe().isEmpty()) {
            return SignalOutcome.of(evaluationId, aggregated, EmissionStatus.NO_READINGS, List.of(), List.of());
        }
        if (!emissionGate.allows(aggregated)) {
            TraceContextUtil.withMdc(evaluationId, aggregated.instrumentId(), () ->
                log.info("GATE_REJECT instrument={} direction={} confidence={} agreement={} policy={} minConfidence={}",
                         aggregated.instrumentId(), aggregated.overallDirection(),
                         String.format("%.3f", aggregated.overallConfidence()),
                         String.format("%.2f", aggregated.agreementRatio()),
                         emissionGate.policy(), emissionGate.minConfidence()));
            return SignalOutcome.of(evaluationId, aggregated, EmissionStatus.BELOW_THRESHOLD, List.of(), List.of());
        }

        List<Signal> emitted    = new ArrayList<>();
        List<Signal> suppressed = new ArrayList<>();
        for (Signal signal : aggregated.perTimeframe()) {
            if (signal.direction() != aggregated.overallDirection()) {
                continue;
            }
            if (deduplicationCache.shouldEmit(aggregated.instrumentId(), signal.signalType(), signal.timeframe())) {
                publish(evaluationId, signal);
                emitted.add(signal);
            } else {
                suppressed.add(signal);
            }
        }
        EmissionStatus status = emitted.isEmpty() ? EmissionStatus.SUPPRESSED : EmissionStatus.EMITTED;
        return SignalOutcome.of(evaluationId, aggregated, status, emitted, suppressed);
    }

    private void publish(String evaluationId, Signal signal) {
        TraceContextUtil.withMdc(evaluationId, signal.instrumentId(), () -> {
            log.info("EMIT instrument={} timeframe={} type={} strength={} confidence={}",
                     signal.instrumentId(), signal.timeframe(), signal.signalType(),
                     String.format("%.3f", signal.strength()), String.format("%.3f", signal.confidence()));
            try {
                recorder.recordSignal(signal);
            } catch (RuntimeException e) {
                log.error("Recorder failed for instrument={} timeframe={}", signal.instrumentId(), signal.timeframe(), e);
            }
            try {
                notifier.notify(signal);
            } catch (RuntimeException e) {
                log.error("Notifier failed for instrument={} timeframe={}", signal.instrumentId(), signal.timeframe(), e);
            }
        });
    }
}
