package com.analyticsplatform.common.agent;

@FunctionalInterface
public interface AgentConstructor {
    Agent create(String instanceId);
}
