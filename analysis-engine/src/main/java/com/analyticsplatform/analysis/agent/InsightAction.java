package com.analyticsplatform.analysis.agent;

import com.analyticsplatform.common.agent.AgentAction;
import com.analyticsplatform.common.agent.AgentCapability;

import java.util.List;

import static com.analyticsplatform.common.permission.PermissionLevel.READ_EXECUTE;
import static com.analyticsplatform.common.permission.PermissionLevel.READ_EXECUTE_WRITE;

public enum InsightAction implements AgentAction {
    GENERATE_ANALYSIS(AgentCapability.of("generate_analysis",
        "Explain the largest home/away feature gaps of a game",
        READ_EXECUTE, List.of("feature_table"), List.of("features"), 1.0)),
    STATISTICAL_ANALYSIS(AgentCapability.of("statistical_analysis",
        "Summary statistics of features across games",
        READ_EXECUTE, List.of("feature_table"), List.of("features"), 1.5)),
    COMPARATIVE_ANALYSIS(AgentCapability.of("comparative_analysis",
        "Rank games by the home-minus-away gap of one metric",
        READ_EXECUTE_WRITE, List.of("feature_table"), List.of("features"), 2.0));

    private final AgentCapability capability;

    InsightAction(AgentCapability capability) {
        this.capability = capability;
    }

    @Override
    public AgentCapability capability() {
        return capability;
    }
}
