package com.analyticsplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;

/**
 * Carries the request id through Reactor pipelines.
 *
 * <p>Reactor Context is the single source of truth for the request id inside reactive
 * pipelines. MDC is only written as a temporary bridge around a log statement, never as a
 * persistent ThreadLocal store.
 *
 * <pre>
 *     return TraceContextUtil.withRequestId(pipeline, request.requestId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String REQUEST_ID_KEY = "requestId";

    private TraceContextUtil() {}

    /**
     * Stores {@code requestId} in the Reactor Context. {@code contextWrite} propagates
     * upstream during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withRequestId(Mono<T> mono, String requestId) {
        return mono.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    /**
     * Bridges {@code requestId} into MDC for the duration of {@code logAction}, then
     * removes it. Only for logging side-effects.
     */
    public static void withMdc(String requestId, Runnable logAction) {
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            logAction.run();
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }
}
