package com.identityguardian.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a {@code traceId} through reactive pipelines.
 *
 * <p>The Reactor Context holds the traceId for the lifetime of an evaluation, a callback
 * delivery or a lifecycle sync. MDC is written only for the duration of a single log
 * statement via {@link #withMdc}, never left populated on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(engine.evaluate(principalId), traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /** Returns the supplied header value, or a fresh random id when the header is absent. */
    public static String resolveTraceId(String headerValue) {
        return headerValue == null || headerValue.isBlank()
            ? UUID.randomUUID().toString()
            : headerValue;
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    public static <T> Flux<T> withTraceId(Flux<T> flux, String traceId) {
        return flux.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * Reads the traceId from a Reactor {@link ContextView}; {@code "unknown"} when absent,
     * never {@code null}.
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Runs {@code logAction} with the traceId bridged into MDC, then clears the entry.
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
