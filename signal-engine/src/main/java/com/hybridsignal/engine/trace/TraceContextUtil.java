package com.hybridsignal.engine.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the identity of one evaluation run: its generated id and the instrument it
 * evaluates.
 *
 * <p>Inside the pipeline both live only in the Reactor Context. MDC gets them for the
 * duration of a single log statement, so log lines of concurrent evaluations of different
 * instruments never pick up each other's ids.
 *
 * <pre>
 *     return TraceContextUtil.withEvaluation(pipeline, evaluationId, instrumentId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String EVALUATION_ID_KEY = "evaluationId";
    public static final String INSTRUMENT_KEY    = "instrument";

    static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Fresh evaluation id, prefixed with the instrument so it can be grepped per symbol. */
    public static String newEvaluationId(String instrumentId) {
        return instrumentId + "-" + UUID.randomUUID();
    }

    /**
     * Stores the evaluation identity in the Reactor Context of {@code mono}. {@code contextWrite}
     * propagates upstream, so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withEvaluation(Mono<T> mono, String evaluationId, String instrumentId) {
        return mono.contextWrite(ctx -> ctx.put(EVALUATION_ID_KEY, evaluationId)
                                           .put(INSTRUMENT_KEY, instrumentId));
    }

    public static String getEvaluationId(ContextView ctx) {
        return ctx.getOrDefault(EVALUATION_ID_KEY, UNKNOWN);
    }

    public static String getInstrumentId(ContextView ctx) {
        return ctx.getOrDefault(INSTRUMENT_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with both ids bridged into MDC, removed again afterwards. */
    public static void withMdc(String evaluationId, String instrumentId, Runnable logAction) {
        MDC.put(EVALUATION_ID_KEY, evaluationId);
        MDC.put(INSTRUMENT_KEY, instrumentId);
        try {
            logAction.run();
        } finally {
            MDC.remove(EVALUATION_ID_KEY);
            MDC.remove(INSTRUMENT_KEY);
        }
    }
}
