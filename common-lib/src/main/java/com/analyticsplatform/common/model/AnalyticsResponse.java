package com.analyticsplatform.common.model;

import com.analyticsplatform.common.agent.ActionResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The sole outbound shape. {@code status} is {@code error} only when every selected agent
 * failed; individual failures stay visible in their own {@code results} slot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyticsResponse(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("status") ResponseStatus status,
    @JsonProperty("results") Map<String, ActionResult> results,
    @JsonProperty("insights") List<String> insights,
    @JsonProperty("execution_time") Duration executionTime,
    @JsonProperty("agent_timings") Map<String, Duration> agentTimings,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("metadata") ResponseMetadata metadata
) {
    public AnalyticsResponse {
        results      = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        insights     = insights == null ? List.of() : List.copyOf(insights);
        agentTimings = agentTimings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(agentTimings));
    }

    public static AnalyticsResponse failed(String requestId, String errorMessage, Duration executionTime,
                                           ResponseMetadata metadata) {
        return new AnalyticsResponse(requestId, ResponseStatus.ERROR, Map.of(), List.of(),
            executionTime, Map.of(), errorMessage, metadata);
    }
}
