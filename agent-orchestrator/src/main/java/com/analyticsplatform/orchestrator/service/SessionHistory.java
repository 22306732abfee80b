package com.analyticsplatform.orchestrator.service;

import com.analyticsplatform.common.model.ResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Bounded log of finished requests, kept globally and per user, plus the set of open sessions.
 *
 * <p>The global log and each user's log keep at most {@code capacity} entries, oldest dropped
 * first. A request joins a session when it names an open session id; requests naming an
 * unknown or ended session are still logged, without the session link. Thread-safe.
 */
public class SessionHistory {

    private static final Logger log = LoggerFactory.getLogger(SessionHistory.class);

    private final int capacity;
    private final Clock clock;
    private final Deque<SessionEntry> entries = new ArrayDeque<>();
    private final Map<String, Deque<SessionEntry>> byUser = new HashMap<>();
    private final Map<String, AnalyticsSession> activeSessions = new HashMap<>();

    public SessionHistory(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public SessionHistory(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized void record(SessionEntry entry) {
        SessionEntry stored = entry;
        if (entry.sessionId() != null) {
            AnalyticsSession session = activeSessions.get(entry.sessionId());
            if (session != null && session.userId().equals(entry.userId())) {
                activeSessions.put(session.sessionId(), session.withInteraction());
            } else {
                log.warn("[SessionHistory] requestId={} names sessionId={} which is not open for userId={}",
                         entry.requestId(), entry.sessionId(), entry.userId());
                stored = new SessionEntry(entry.requestId(), entry.userId(), null, entry.queryType(),
                    entry.status(), entry.agentsUsed(), entry.executionTime(), entry.timestamp());
            }
        }
        append(entries, stored);
        if (stored.userId() != null) {
            append(byUser.computeIfAbsent(stored.userId(), u -> new ArrayDeque<>()), stored);
        }
    }

    public synchronized List<SessionEntry> recent() {
        return List.copyOf(new ArrayList<>(entries));
    }

    public synchronized List<SessionEntry> recent(String userId) {
        Deque<SessionEntry> own = byUser.get(userId);
        return own == null ? List.of() : List.copyOf(new ArrayList<>(own));
    }

    public synchronized int size() {
        return entries.size();
    }

    // ── sessions ──────────────────────────────────────────────────────────

    public synchronized AnalyticsSession startSession(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required to start a session");
        }
        AnalyticsSession session = new AnalyticsSession(UUID.randomUUID().toString(), userId, clock.instant(), null, 0);
        activeSessions.put(session.sessionId(), session);
        log.info("[SessionHistory] Started sessionId={} userId={}", session.sessionId(), userId);
        return session;
    }

    /** Closes an open session and returns its final state; empty when no such session is open. */
    public synchronized Optional<AnalyticsSession> endSession(String sessionId) {
        AnalyticsSession open = sessionId == null ? null : activeSessions.remove(sessionId);
        if (open == null) {
            return Optional.empty();
        }
        AnalyticsSession ended = open.endedAt(clock.instant());
        log.info("[SessionHistory] Ended sessionId={} userId={} interactions={} duration={}ms",
                 sessionId, ended.userId(), ended.interactions(), ended.duration().toMillis());
        return Optional.of(ended);
    }

    public synchronized Optional<AnalyticsSession> session(String sessionId) {
        return Optional.ofNullable(sessionId == null ? null : activeSessions.get(sessionId));
    }

    // ── summary ───────────────────────────────────────────────────────────

    /** Summary for {@code userId}, or over every user when it is null. */
    public synchronized SessionSummary summary(String userId) {
        List<SessionEntry> scope = userId == null ? new ArrayList<>(entries) : recent(userId);

        Map<String, Long> queryTypes = new TreeMap<>();
        TreeSet<String> agents = new TreeSet<>();
        int successful = 0;
        for (SessionEntry e : scope) {
            queryTypes.merge(String.valueOf(e.queryType()), 1L, Long::sum);
            agents.addAll(e.agentsUsed());
            if (e.status() == ResponseStatus.SUCCESS) {
                successful++;
            }
        }
        int open = (int) activeSessions.values().stream()
            .filter(s -> userId == null || userId.equals(s.userId()))
            .count();

        return new SessionSummary(userId, scope.size(), successful, queryTypes, List.copyOf(agents), open,
            scope.isEmpty() ? null : scope.get(0).timestamp(),
            scope.isEmpty() ? null : scope.get(scope.size() - 1).timestamp());
    }

    private void append(Deque<SessionEntry> target, SessionEntry entry) {
        target.addLast(entry);
        while (target.size() > capacity) {
            target.removeFirst();
        }
    }
}
