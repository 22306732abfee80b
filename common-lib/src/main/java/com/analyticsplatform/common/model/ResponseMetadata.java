package com.analyticsplatform.common.model;

import com.analyticsplatform.common.permission.PermissionLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ResponseMetadata(
    @JsonProperty("query_type") String queryType,
    @JsonProperty("user_role") UserRole role,
    @JsonProperty("budget_fraction") double budgetFraction,
    @JsonProperty("granted_level") PermissionLevel grantedLevel,
    @JsonProperty("agents_used") List<String> agentsUsed,
    @JsonProperty("agents_failed") List<String> agentsFailed
) {
    public ResponseMetadata {
        agentsUsed   = agentsUsed == null ? List.of() : List.copyOf(agentsUsed);
        agentsFailed = agentsFailed == null ? List.of() : List.copyOf(agentsFailed);
    }
}
