package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.permission.PermissionLevel;

import java.util.List;
import java.util.Map;

/**
 * Capability provider contract. Instances are created once by {@link AgentFactory},
 * reused across requests, and hold no per-request mutable state.
 *
 * <p>{@link #execute} returns exactly once per call. Business failures come back as
 * {@link ActionResult#error}; only programmer or wiring errors may be thrown.
 */
public interface Agent {

    String agentId();

    String typeName();

    /** Highest permission any of this agent's capabilities may require. */
    PermissionLevel ceiling();

    List<AgentCapability> listCapabilities();

    ActionResult execute(String action, Map<String, Object> parameters, CallerContext callerContext);
}
