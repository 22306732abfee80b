package com.analyticsplatform.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for business failures inside agents and the model engine.
 * Carries a stable {@link AnalyticsErrorCode} and an unmodifiable diagnostic context.
 *
 * <p>Agents translate these into error {@code ActionResult}s; they are never allowed to
 * cross the orchestrator boundary.
 */
public class AnalyticsException extends RuntimeException {

    private final AnalyticsErrorCode code;
    private final Map<String, Object> context;

    public AnalyticsException(AnalyticsErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public AnalyticsException(AnalyticsErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public AnalyticsException(AnalyticsErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public AnalyticsException(AnalyticsErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public AnalyticsErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) return Collections.emptyMap();
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
            + "{code=" + code
            + ", message=" + getMessage()
            + (context.isEmpty() ? "" : ", context=" + context)
            + '}';
    }
}
