package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.permission.PermissionLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A named, permission-scoped unit of agent functionality. Owned by the agent that declares it.
 */
public record AgentCapability(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("required_permission") PermissionLevel requiredPermission,
    @JsonProperty("tools") List<String> tools,
    @JsonProperty("data_access") List<String> dataAccess,
    @JsonProperty("time_estimate_seconds") double timeEstimateSeconds
) {
    public AgentCapability {
        tools = tools == null ? List.of() : List.copyOf(tools);
        dataAccess = dataAccess == null ? List.of() : List.copyOf(dataAccess);
    }

    public static AgentCapability of(String name, String description, PermissionLevel requiredPermission,
                                     List<String> tools, List<String> dataAccess,
                                     double timeEstimateSeconds) {
        return new AgentCapability(name, description, requiredPermission, tools, dataAccess, timeEstimateSeconds);
    }
}
