package com.analyticsplatform.common.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetricsSnapshot(
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("successful_requests") long successfulRequests,
    @JsonProperty("failed_requests") long failedRequests,
    @JsonProperty("average_response_time_ms") double averageResponseTimeMs,
    @JsonProperty("agent_calls") long agentCalls,
    @JsonProperty("agent_failures") long agentFailures
) {
    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(0, 0, 0, 0.0, 0, 0);
    }
}
