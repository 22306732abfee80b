package com.analyticsplatform.orchestrator.metrics;

import com.analyticsplatform.common.metrics.MetricsSink;
import com.analyticsplatform.common.metrics.MetricsSnapshot;
import com.analyticsplatform.common.model.ResponseStatus;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide request counters backed by {@link AtomicLong}s.
 *
 * <pre>
 *   averageResponseTimeMs = totalResponseTimeMs / totalRequests
 * </pre>
 * The snapshot is not taken atomically across counters.
 */
public class AtomicMetricsSink implements MetricsSink {

    private final AtomicLong totalRequests       = new AtomicLong();
    private final AtomicLong successfulRequests  = new AtomicLong();
    private final AtomicLong totalResponseTimeMs = new AtomicLong();
    private final AtomicLong agentCalls          = new AtomicLong();
    private final AtomicLong agentFailures       = new AtomicLong();

    @Override
    public void recordRequest(ResponseStatus status, Duration elapsed) {
        totalRequests.incrementAndGet();
        if (status == ResponseStatus.SUCCESS) {
            successfulRequests.incrementAndGet();
        }
        totalResponseTimeMs.addAndGet(elapsed == null ? 0 : elapsed.toMillis());
    }

    @Override
    public void recordAgentOutcome(String agentId, boolean success, Duration elapsed) {
        agentCalls.incrementAndGet();
        if (!success) {
            agentFailures.incrementAndGet();
        }
    }

    @Override
    public MetricsSnapshot snapshot() {
        long total = totalRequests.get();
        long successful = successfulRequests.get();
        double average = total == 0 ? 0.0 : (double) totalResponseTimeMs.get() / total;
        return new MetricsSnapshot(total, successful, total - successful, average,
            agentCalls.get(), agentFailures.get());
    }
}
