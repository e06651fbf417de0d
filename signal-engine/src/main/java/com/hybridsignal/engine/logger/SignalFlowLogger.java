package com.hybridsignal.engine.logger;

import com.hybridsignal.core.model.AggregatedSignal;
import com.hybridsignal.engine.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the stages an evaluation passes through in {@code HybridSignalService}. Pure side
 * effects; never changes pipeline behavior.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #READINGS_RECEIVED}   : readings merged per timeframe</li>
 *   <li>{@link #TIMEFRAMES_EVALUATED}: every timeframe produced a hybrid signal</li>
 *   <li>{@link #SIGNALS_AGGREGATED}  : cross-timeframe aggregate built</li>
 *   <li>{@link #EMISSION_GATED}      : policy, confidence and dedup gate decided</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(signalFlowLogger.stage(SignalFlowLogger.SIGNALS_AGGREGATED))
 * </pre>
 */
@Component
public class SignalFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(SignalFlowLogger.class);

    public static final String READINGS_RECEIVED    = "READINGS_RECEIVED";
    public static final String TIMEFRAMES_EVALUATED = "TIMEFRAMES_EVALUATED";
    public static final String SIGNALS_AGGREGATED   = "SIGNALS_AGGREGATED";
    public static final String EMISSION_GATED       = "EMISSION_GATED";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on {@code onNext}. The evaluation id
     * and instrument are read from the Reactor Context, never from MDC.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String evaluationId = TraceContextUtil.getEvaluationId(signal.getContextView());
            String instrumentId = TraceContextUtil.getInstrumentId(signal.getContextView());
            TraceContextUtil.withMdc(evaluationId, instrumentId, () ->
                log.info("[SignalFlow] stage={} instrument={} evaluationId={}", stageName, instrumentId, evaluationId)
            );
        };
    }

    /** One-line summary of an aggregate, logged once per evaluation. */
    public void logAggregate(AggregatedSignal aggregated, String evaluationId) {
        TraceContextUtil.withMdc(evaluationId, aggregated.instrumentId(), () ->
            log.info("[SignalFlow] stage={} instrument={} direction={} confidence={} strength={} "
                     + "agreement={} timeframes={} evaluationId={}",
                     SIGNALS_AGGREGATED,
                     aggregated.instrumentId(), aggregated.overallDirection(),
                     String.format("%.3f", aggregated.overallConfidence()),
                     String.format("%.3f", aggregated.overallStrength()),
                     String.format("%.2f", aggregated.agreementRatio()),
                     aggregated.perTimeframe().size(),
                     evaluationId)
        );
    }
}
