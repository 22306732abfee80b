package com.analyticsplatform.common.exception;

/**
 * Failure inside an agent while it performs one action. Reported to callers as
 * {@link AnalyticsErrorCode#AGENT_EXECUTION_ERROR}; the message names the agent and action.
 */
public class AgentException extends RuntimeException {

    private final String agentId;
    private final String action;

    public AgentException(String agentId, String action, String message) {
        this(agentId, action, message, null);
    }

    public AgentException(String agentId, String action, String message, Throwable cause) {
        super("[" + agentId + "] action=" + action + ": " + message, cause);
        this.agentId = agentId;
        this.action = action;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getAction() {
        return action;
    }

    public AnalyticsErrorCode getCode() {
        return AnalyticsErrorCode.AGENT_EXECUTION_ERROR;
    }
}
