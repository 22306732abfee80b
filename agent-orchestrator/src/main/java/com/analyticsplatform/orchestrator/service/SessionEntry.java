package com.analyticsplatform.orchestrator.service;

import com.analyticsplatform.common.model.ResponseStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** One finished request. {@code sessionId} is null for requests sent outside a session. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionEntry(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("query_type") String queryType,
    @JsonProperty("status") ResponseStatus status,
    @JsonProperty("agents_used") List<String> agentsUsed,
    @JsonProperty("execution_time") Duration executionTime,
    @JsonProperty("timestamp") Instant timestamp
) {
    public SessionEntry {
        agentsUsed = agentsUsed == null ? List.of() : List.copyOf(agentsUsed);
    }
}
