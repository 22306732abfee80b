package com.analyticsplatform.orchestrator.metrics;

import com.analyticsplatform.common.metrics.MetricsSnapshot;
import com.analyticsplatform.common.model.ResponseStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AtomicMetricsSinkTest {

    @Test
    @DisplayName("empty sink reports zeros")
    void empty() {
        assertEquals(MetricsSnapshot.empty(), new AtomicMetricsSink().snapshot());
    }

    @Test
    @DisplayName("average response time is total time over total requests")
    void averages() {
        AtomicMetricsSink sink = new AtomicMetricsSink();
        sink.recordRequest(ResponseStatus.SUCCESS, Duration.ofMillis(100));
        sink.recordRequest(ResponseStatus.ERROR, Duration.ofMillis(300));
        sink.recordAgentOutcome("model_engine", true, Duration.ofMillis(50));
        sink.recordAgentOutcome("insight_generator", false, Duration.ofMillis(70));

        MetricsSnapshot snapshot = sink.snapshot();
        assertEquals(2, snapshot.totalRequests());
        assertEquals(1, snapshot.successfulRequests());
        assertEquals(1, snapshot.failedRequests());
        assertEquals(200.0, snapshot.averageResponseTimeMs(), 1e-9);
        assertEquals(2, snapshot.agentCalls());
        assertEquals(1, snapshot.agentFailures());
    }
}
