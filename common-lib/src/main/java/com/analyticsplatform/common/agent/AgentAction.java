package com.analyticsplatform.common.agent;

/**
 * Implemented by each agent's closed action enum. The wire-level action string is parsed
 * into a constant once, then matched exhaustively by the agent.
 */
public interface AgentAction {

    AgentCapability capability();

    default String actionName() {
        return capability().name();
    }
}
