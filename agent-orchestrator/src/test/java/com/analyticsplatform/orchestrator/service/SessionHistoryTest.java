package com.analyticsplatform.orchestrator.service;

import com.analyticsplatform.common.model.ResponseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionHistoryTest {

    private static final Instant T0 = Instant.parse("2025-11-29T17:00:00Z");

    private SteppingClock clock;
    private SessionHistory history;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(T0);
        history = new SessionHistory(3, clock);
    }

    @Nested
    @DisplayName("per-user history")
    class PerUserTests {

        @Test
        @DisplayName("entries are kept per user as well as globally")
        void keyedByUser() {
            history.record(entry("r1", "alice", null, "prediction", ResponseStatus.SUCCESS, "model_engine"));
            history.record(entry("r2", "bob", null, "learning", ResponseStatus.SUCCESS, "learning_navigator"));
            history.record(entry("r3", "alice", null, "analysis", ResponseStatus.ERROR, "insight_generator"));

            assertEquals(3, history.size());
            assertEquals(List.of("r1", "r3"), history.recent("alice").stream().map(SessionEntry::requestId).toList());
            assertEquals(List.of("r2"), history.recent("bob").stream().map(SessionEntry::requestId).toList());
            assertTrue(history.recent("carol").isEmpty());
        }

        @Test
        @DisplayName("each user's log is bounded independently of the global one")
        void boundedPerUser() {
            for (int i = 0; i < 5; i++) {
                history.record(entry("a" + i, "alice", null, "prediction", ResponseStatus.SUCCESS, "model_engine"));
            }
            history.record(entry("b0", "bob", null, "learning", ResponseStatus.SUCCESS, "learning_navigator"));

            assertEquals(List.of("a2", "a3", "a4"),
                history.recent("alice").stream().map(SessionEntry::requestId).toList());
            assertEquals(List.of("a3", "a4", "b0"),
                history.recent().stream().map(SessionEntry::requestId).toList());
            assertEquals(1, history.recent("bob").size());
        }

        @Test
        @DisplayName("capacity below one is rejected")
        void invalidCapacity() {
            assertThrows(IllegalArgumentException.class, () -> new SessionHistory(0));
        }
    }

    @Nested
    @DisplayName("summary")
    class SummaryTests {

        @Test
        @DisplayName("counts interactions, query types and agents for one user")
        void userSummary() {
            history.record(entry("r1", "alice", null, "prediction", ResponseStatus.SUCCESS, "model_engine", "insight_generator"));
            history.record(entry("r2", "alice", null, "prediction", ResponseStatus.ERROR, "model_engine"));
            history.record(entry("r3", "bob", null, "learning", ResponseStatus.SUCCESS, "learning_navigator"));

            SessionSummary summary = history.summary("alice");
            assertEquals("alice", summary.userId());
            assertEquals(2, summary.totalInteractions());
            assertEquals(1, summary.successfulInteractions());
            assertEquals(Map.of("prediction", 2L), summary.queryTypes());
            assertEquals(List.of("insight_generator", "model_engine"), summary.agentsUsed());
            assertEquals(0, summary.activeSessions());
        }

        @Test
        @DisplayName("null user summarizes everyone")
        void globalSummary() {
            history.record(entry("r1", "alice", null, "prediction", ResponseStatus.SUCCESS, "model_engine"));
            history.record(entry("r2", "bob", null, "learning", ResponseStatus.SUCCESS, "learning_navigator"));
            history.startSession("carol");

            SessionSummary summary = history.summary(null);
            assertNull(summary.userId());
            assertEquals(2, summary.totalInteractions());
            assertEquals(Map.of("learning", 1L, "prediction", 1L), summary.queryTypes());
            assertEquals(1, summary.activeSessions());
        }

        @Test
        @DisplayName("unknown user → empty summary without timestamps")
        void emptySummary() {
            SessionSummary summary = history.summary("nobody");
            assertEquals(0, summary.totalInteractions());
            assertTrue(summary.queryTypes().isEmpty());
            assertNull(summary.firstInteraction());
            assertNull(summary.lastInteraction());
        }
    }

    @Nested
    @DisplayName("session lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("start → record → end reports interactions and duration")
        void startRecordEnd() {
            AnalyticsSession started = history.startSession("alice");
            assertTrue(started.isActive());
            assertEquals(T0, started.startedAt());

            history.record(entry("r1", "alice", started.sessionId(), "prediction", ResponseStatus.SUCCESS, "model_engine"));
            history.record(entry("r2", "alice", started.sessionId(), "analysis", ResponseStatus.SUCCESS, "insight_generator"));
            assertEquals(2, history.session(started.sessionId()).orElseThrow().interactions());

            clock.advance(Duration.ofSeconds(90));
            AnalyticsSession ended = history.endSession(started.sessionId()).orElseThrow();
            assertFalse(ended.isActive());
            assertEquals(2, ended.interactions());
            assertEquals(Duration.ofSeconds(90), ended.duration());
            assertTrue(history.session(started.sessionId()).isEmpty());
        }

        @Test
        @DisplayName("ending an unknown or already ended session is empty")
        void endUnknown() {
            AnalyticsSession started = history.startSession("alice");
            assertTrue(history.endSession(started.sessionId()).isPresent());
            assertTrue(history.endSession(started.sessionId()).isEmpty());
            assertTrue(history.endSession("no-such-session").isEmpty());
            assertTrue(history.endSession(null).isEmpty());
        }

        @Test
        @DisplayName("a request naming another user's session is logged without the session link")
        void foreignSession() {
            AnalyticsSession bobs = history.startSession("bob");
            history.record(entry("r1", "alice", bobs.sessionId(), "prediction", ResponseStatus.SUCCESS, "model_engine"));

            assertNull(history.recent("alice").get(0).sessionId());
            assertEquals(0, history.session(bobs.sessionId()).orElseThrow().interactions());
        }

        @Test
        @DisplayName("blank user cannot start a session")
        void blankUser() {
            assertThrows(IllegalArgumentException.class, () -> history.startSession(" "));
        }
    }

    private SessionEntry entry(String requestId, String userId, String sessionId, String queryType,
                               ResponseStatus status, String... agents) {
        return new SessionEntry(requestId, userId, sessionId, queryType, status, List.of(agents),
            Duration.ofMillis(12), clock.instant());
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
