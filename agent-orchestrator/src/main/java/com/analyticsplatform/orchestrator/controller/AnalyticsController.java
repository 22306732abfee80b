package com.analyticsplatform.orchestrator.controller;

import com.analyticsplatform.common.model.AnalyticsRequest;
import com.analyticsplatform.common.model.AnalyticsResponse;
import com.analyticsplatform.orchestrator.service.AnalyticsOrchestrator;
import com.analyticsplatform.orchestrator.service.AnalyticsSession;
import com.analyticsplatform.orchestrator.service.SessionSummary;
import com.analyticsplatform.orchestrator.service.SystemStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private final AnalyticsOrchestrator orchestrator;

    public AnalyticsController(AnalyticsOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/query")
    public Mono<ResponseEntity<AnalyticsResponse>> query(@RequestBody AnalyticsRequest request) {
        return orchestrator.process(request).map(ResponseEntity::ok);
    }

    @PostMapping("/sessions")
    public ResponseEntity<AnalyticsSession> startSession(@RequestParam("user_id") String userId) {
        if (userId.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(orchestrator.startSession(userId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<AnalyticsSession> endSession(@PathVariable String sessionId) {
        return orchestrator.endSession(sessionId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /** Summary for one user, or for every user when {@code user_id} is omitted. */
    @GetMapping("/sessions/summary")
    public ResponseEntity<SessionSummary> sessionSummary(@RequestParam(name = "user_id", required = false) String userId) {
        return ResponseEntity.ok(orchestrator.sessionSummary(userId));
    }

    @GetMapping("/status")
    public ResponseEntity<SystemStatus> status() {
        return ResponseEntity.ok(orchestrator.systemStatus());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
