package com.analyticsplatform.orchestrator.service;

import com.analyticsplatform.common.agent.ActionResult;
import com.analyticsplatform.orchestrator.routing.RouteStep;

import java.time.Duration;

/** Result slot of one route step, with its wall-clock time. */
public record AgentOutcome(RouteStep step, ActionResult result, Duration elapsed) {

    public String agentId() {
        return step.agentId();
    }
}
