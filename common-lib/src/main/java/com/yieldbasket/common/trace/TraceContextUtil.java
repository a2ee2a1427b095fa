package com.yieldbasket.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the cycle trace id through Reactor pipelines.
 *
 * <p>The Reactor Context holds the id; MDC is written only for the span of a single
 * log statement and removed straight after, never left on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(cycle, traceId);
 *     ...
 *     .doOnEach(signal -> TraceContextUtil.withMdc(TraceContextUtil.getTraceId(signal.getContextView()), () -> log.info(...)))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN      = "unknown";

    private TraceContextUtil() {}

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId != null ? traceId : UNKNOWN));
    }

    public static <T> Flux<T> withTraceId(Flux<T> flux, String traceId) {
        return flux.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId != null ? traceId : UNKNOWN));
    }

    /** Never {@code null}; {@value #UNKNOWN} when the pipeline was not tagged. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
