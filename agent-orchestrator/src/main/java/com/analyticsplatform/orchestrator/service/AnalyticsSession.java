package com.analyticsplatform.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/** A user session opened with {@link SessionHistory#startSession}. Immutable snapshot. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyticsSession(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("ended_at") Instant endedAt,
    @JsonProperty("interactions") int interactions
) {
    AnalyticsSession withInteraction() {
        return new AnalyticsSession(sessionId, userId, startedAt, endedAt, interactions + 1);
    }

    AnalyticsSession endedAt(Instant end) {
        return new AnalyticsSession(sessionId, userId, startedAt, end, interactions);
    }

    @JsonIgnore
    public boolean isActive() {
        return endedAt == null;
    }

    /** Elapsed time until {@code endedAt}, or null while the session is open. */
    @JsonProperty("duration")
    public Duration duration() {
        return endedAt == null ? null : Duration.between(startedAt, endedAt);
    }
}
