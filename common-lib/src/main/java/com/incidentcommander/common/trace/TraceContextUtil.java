package com.incidentcommander.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the incident id through reactive pipelines as the log trace key.
 *
 * <p>The Reactor Context is the only holder of the trace id inside a pipeline. MDC is written
 * for the duration of one log statement and cleared straight after, so nothing leaks between
 * incidents sharing a {@code boundedElastic} worker.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(resolve(incident), incident.id());
 *     ...
 *     .doOnEach(signal -> log(TraceContextUtil.getTraceId(signal.getContextView()), ...))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN      = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context. {@code contextWrite} applies upstream,
     * so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, or {@value #UNKNOWN}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with {@code traceId} bridged into MDC, then removes it.
     * Only for logging side effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
