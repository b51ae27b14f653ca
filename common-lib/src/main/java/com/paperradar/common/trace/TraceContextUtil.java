package com.paperradar.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the ranking cycle id as the trace id of every log line a cycle produces.
 *
 * <p>The Reactor Context holds the id for the lifetime of the pipeline. MDC is written
 * only for the duration of a single log call:
 * <pre>
 *     return TraceContextUtil.withTraceId(cyclePipeline, cycleId);
 *     ...
 *     TraceContextUtil.withMdc(cycleId, () -&gt; log.info("CYCLE_COMPLETE ..."));
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /** Short random id used for cycles started by the scheduler or an operator. */
    public static String newCycleId() {
        return "cyc-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Stores {@code traceId} in the Reactor Context. {@code contextWrite} propagates upstream,
     * so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, {@code "unknown"} when absent. Never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Puts {@code traceId} into MDC while {@code logAction} runs, then removes it.
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
