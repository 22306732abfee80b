package com.analyticsplatform.orchestrator.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One candidate invocation: which agent instance, which action. */
public record RouteStep(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("action") String action
) {
    public static RouteStep of(String agentId, String action) {
        return new RouteStep(agentId, action);
    }
}
