package com.analyticsplatform.common.exception;

/**
 * Wiring error raised by the agent factory: non-conforming agent, conflicting constructor
 * for a type name, unknown type, or duplicate instance id. Propagates to the caller.
 */
public class AgentRegistrationException extends RuntimeException {

    public AgentRegistrationException(String message) {
        super(message);
    }

    public AgentRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
