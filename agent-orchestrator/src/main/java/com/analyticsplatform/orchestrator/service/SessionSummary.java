package com.analyticsplatform.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate over the retained history of one user, or of every user when {@code userId} is
 * null. {@code queryTypes} counts requests per query type; {@code agentsUsed} is sorted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSummary(
    @JsonProperty("user_id") String userId,
    @JsonProperty("total_interactions") int totalInteractions,
    @JsonProperty("successful_interactions") int successfulInteractions,
    @JsonProperty("query_types") Map<String, Long> queryTypes,
    @JsonProperty("agents_used") List<String> agentsUsed,
    @JsonProperty("active_sessions") int activeSessions,
    @JsonProperty("first_interaction") Instant firstInteraction,
    @JsonProperty("last_interaction") Instant lastInteraction
) {}
