package com.analyticsplatform.orchestrator.service;

import com.analyticsplatform.common.agent.AgentDescriptor;
import com.analyticsplatform.common.metrics.MetricsSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

public record SystemStatus(
    @JsonProperty("metrics") MetricsSnapshot metrics,
    @JsonProperty("agents") List<AgentDescriptor> agents,
    @JsonProperty("registered_types") Set<String> registeredTypes,
    @JsonProperty("query_types") List<String> queryTypes,
    @JsonProperty("recent_requests") List<SessionEntry> recentRequests
) {}
