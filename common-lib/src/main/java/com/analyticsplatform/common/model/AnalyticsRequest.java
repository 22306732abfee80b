package com.analyticsplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * The sole inbound shape. Created per call and discarded afterwards.
 *
 * <p>{@code requestId} and {@code timestamp} are assigned when the caller omits them.
 * {@code parameters} and {@code contextHints} are copied and never null.
 */
public record AnalyticsRequest(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("query") String query,
    @JsonProperty("query_type") String queryType,
    @JsonProperty("parameters") Map<String, Object> parameters,
    @JsonProperty("context_hints") Map<String, Object> contextHints,
    @JsonProperty("timestamp") Instant timestamp
) {
    public AnalyticsRequest {
        requestId    = (requestId == null || requestId.isBlank()) ? UUID.randomUUID().toString() : requestId;
        parameters   = copy(parameters);
        contextHints = copy(contextHints);
        timestamp    = timestamp == null ? Instant.now() : timestamp;
    }

    public static AnalyticsRequest of(String userId, String query, String queryType,
                                      Map<String, Object> parameters,
                                      Map<String, Object> contextHints) {
        return new AnalyticsRequest(null, userId, query, queryType, parameters, contextHints, null);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
