package com.analyticsplatform.analysis.agent;

import com.analyticsplatform.common.agent.AgentAction;
import com.analyticsplatform.common.agent.AgentCapability;

import java.util.List;

import static com.analyticsplatform.common.permission.PermissionLevel.READ_EXECUTE;
import static com.analyticsplatform.common.permission.PermissionLevel.READ_ONLY;

public enum LearningAction implements AgentAction {
    RECOMMEND_CONTENT(AgentCapability.of("recommend_content",
        "Suggest learning resources for a skill level",
        READ_ONLY, List.of("content_catalog"), List.of("learning_content"), 0.5)),
    EXPLAIN_CONCEPTS(AgentCapability.of("explain_concepts",
        "Explain analytics concepts and feature names",
        READ_ONLY, List.of("content_catalog"), List.of("learning_content"), 0.5)),
    GUIDE_LEARNING_PATH(AgentCapability.of("guide_learning_path",
        "Ordered learning path for a skill level",
        READ_EXECUTE, List.of("content_catalog"), List.of("learning_content"), 1.0));

    private final AgentCapability capability;

    LearningAction(AgentCapability capability) {
        this.capability = capability;
    }

    @Override
    public AgentCapability capability() {
        return capability;
    }
}
