package com.analyticsplatform.common.metrics;

import com.analyticsplatform.common.model.ResponseStatus;

import java.time.Duration;

/**
 * Receives request and per-agent outcomes from the orchestrator. Implementations must
 * tolerate concurrent calls from many in-flight requests.
 */
public interface MetricsSink {

    void recordRequest(ResponseStatus status, Duration elapsed);

    void recordAgentOutcome(String agentId, boolean success, Duration elapsed);

    MetricsSnapshot snapshot();
}
