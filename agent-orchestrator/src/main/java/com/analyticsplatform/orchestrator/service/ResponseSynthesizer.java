package com.analyticsplatform.orchestrator.service;

import com.analyticsplatform.common.agent.ActionResult;
import com.analyticsplatform.common.model.AnalyticsResponse;
import com.analyticsplatform.common.model.ResponseMetadata;
import com.analyticsplatform.common.model.ResponseStatus;
import com.analyticsplatform.orchestrator.routing.RouteStep;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-agent outcomes into one {@link AnalyticsResponse}.
 *
 * <ul>
 *   <li>results and timings are keyed by agent id, in route order</li>
 *   <li>status is {@code error} only when every slot failed</li>
 *   <li>insights come from each successful payload's {@code insights} list; each failed slot
 *       adds {@code "Note: <agentId> failed: <message>"}</li>
 * </ul>
 * Stateless.
 */
public final class ResponseSynthesizer {

    private ResponseSynthesizer() {}

    public static AnalyticsResponse synthesize(String requestId,
                                               List<RouteStep> route,
                                               Collection<AgentOutcome> outcomes,
                                               Duration executionTime,
                                               ResponseMetadata baseMetadata) {
        Map<String, AgentOutcome> byAgent = new LinkedHashMap<>();
        for (AgentOutcome o : outcomes) {
            byAgent.put(o.agentId(), o);
        }

        Map<String, ActionResult> results = new LinkedHashMap<>();
        Map<String, Duration> timings = new LinkedHashMap<>();
        List<String> insights = new ArrayList<>();
        List<String> used = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (RouteStep step : route) {
            AgentOutcome outcome = byAgent.get(step.agentId());
            if (outcome == null) continue;
            ActionResult result = outcome.result();
            results.put(step.agentId(), result);
            timings.put(step.agentId(), outcome.elapsed());
            used.add(step.agentId());

            if (result.success()) {
                insights.addAll(insightsOf(result));
            } else {
                failed.add(step.agentId());
                insights.add("Note: " + step.agentId() + " failed: " + result.message());
            }
        }

        boolean anySuccess = results.values().stream().anyMatch(ActionResult::success);
        ResponseStatus status = anySuccess ? ResponseStatus.SUCCESS : ResponseStatus.ERROR;
        String errorMessage = anySuccess ? null
            : results.isEmpty() ? "No agent produced a result" : "All selected agents failed";

        ResponseMetadata metadata = new ResponseMetadata(baseMetadata.queryType(), baseMetadata.role(),
            baseMetadata.budgetFraction(), baseMetadata.grantedLevel(), used, failed);

        return new AnalyticsResponse(requestId, status, results, insights, executionTime, timings,
            errorMessage, metadata);
    }

    private static List<String> insightsOf(ActionResult result) {
        Object raw = result.payload() == null ? null : result.payload().get("insights");
        List<String> out = new ArrayList<>();
        if (raw instanceof Collection<?> values) {
            for (Object v : values) {
                if (v != null) out.add(v.toString());
            }
        }
        return out;
    }
}
