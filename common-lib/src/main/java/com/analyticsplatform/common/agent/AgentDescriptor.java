package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.permission.PermissionLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AgentDescriptor(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("type") String typeName,
    @JsonProperty("ceiling") PermissionLevel ceiling,
    @JsonProperty("capabilities") List<String> capabilities
) {
    public static AgentDescriptor of(Agent agent) {
        return new AgentDescriptor(agent.agentId(), agent.typeName(), agent.ceiling(),
            agent.listCapabilities().stream().map(AgentCapability::name).toList());
    }
}
