package com.analyticsplatform.orchestrator.service;

import com.analyticsplatform.common.agent.ActionResult;
import com.analyticsplatform.common.agent.Agent;
import com.analyticsplatform.common.agent.AgentFactory;
import com.analyticsplatform.common.agent.CallerContext;
import com.analyticsplatform.common.context.BuiltContext;
import com.analyticsplatform.common.context.ContextManager;
import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.metrics.MetricsSink;
import com.analyticsplatform.common.model.AnalyticsRequest;
import com.analyticsplatform.common.model.AnalyticsResponse;
import com.analyticsplatform.common.model.ResponseMetadata;
import com.analyticsplatform.common.permission.PermissionCheck;
import com.analyticsplatform.common.permission.PermissionDecision;
import com.analyticsplatform.common.permission.PermissionGuard;
import com.analyticsplatform.common.permission.PermissionLevel;
import com.analyticsplatform.common.trace.TraceContextUtil;
import com.analyticsplatform.orchestrator.logger.RequestFlowLogger;
import com.analyticsplatform.orchestrator.policy.PermissionPolicy;
import com.analyticsplatform.orchestrator.routing.QueryType;
import com.analyticsplatform.orchestrator.routing.RouteStep;
import com.analyticsplatform.orchestrator.routing.RoutingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Top-level request state machine.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>RECEIVED → ROLE_DETECTED: {@link ContextManager#buildContext}; granted level from
 *       {@link PermissionPolicy}.</li>
 *   <li>ROLE_DETECTED → AGENTS_SELECTED: {@code query_type} parsed once into
 *       {@link QueryType}; unknown tags use {@link QueryType#GENERAL}.</li>
 *   <li>AGENTS_SELECTED → EXECUTING: per step, resolve the agent, check permission, then
 *       {@code execute} on {@code boundedElastic} with a per-call timeout. Steps run
 *       concurrently; every step ends in its own result slot whatever happens.</li>
 *   <li>EXECUTING → SYNTHESIZING → COMPLETED: {@link ResponseSynthesizer}.</li>
 *   <li>Any unexpected error → FAILED with an {@code error} response.</li>
 * </ol>
 *
 * <p>After the terminal transition the request outcome goes to the {@link MetricsSink} and the
 * {@link SessionHistory}; a {@code session_id} context hint links it to an open session.
 * {@link #process} never emits an error signal.
 */
public class AnalyticsOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsOrchestrator.class);

    /** Context hint naming the open session a request belongs to. */
    public static final String SESSION_HINT = "session_id";

    private final AgentFactory agentFactory;
    private final ContextManager contextManager;
    private final RoutingTable routingTable;
    private final PermissionPolicy permissionPolicy;
    private final MetricsSink metricsSink;
    private final RequestFlowLogger flowLogger;
    private final SessionHistory sessionHistory;
    private final Duration agentTimeout;
    private final int maxConcurrency;

    public AnalyticsOrchestrator(AgentFactory agentFactory,
                                 ContextManager contextManager,
                                 RoutingTable routingTable,
                                 PermissionPolicy permissionPolicy,
                                 MetricsSink metricsSink,
                                 RequestFlowLogger flowLogger,
                                 SessionHistory sessionHistory,
                                 Duration agentTimeout,
                                 int maxConcurrency) {
        this.agentFactory     = agentFactory;
        this.contextManager   = contextManager;
        this.routingTable     = routingTable;
        this.permissionPolicy = permissionPolicy;
        this.metricsSink      = metricsSink;
        this.flowLogger       = flowLogger;
        this.sessionHistory   = sessionHistory;
        this.agentTimeout     = agentTimeout;
        this.maxConcurrency   = Math.max(1, maxConcurrency);
    }

    public Mono<AnalyticsResponse> process(AnalyticsRequest request) {
        return TraceContextUtil.withRequestId(
            Mono.defer(() -> run(request, System.nanoTime())),
            request.requestId());
    }

    private Mono<AnalyticsResponse> run(AnalyticsRequest request, long startNanos) {
        String requestId = request.requestId();

        return Mono.defer(() -> {
            flowLogger.transition(RequestState.RECEIVED, requestId,
                "userId=" + request.userId() + " queryType=" + request.queryType());

            // ── role + budget ──────────────────────────────────────────────
            BuiltContext context = contextManager.buildContext(request);
            PermissionLevel granted = permissionPolicy.grantedLevel(request.userId(), context.role(), request.contextHints());
            flowLogger.transition(RequestState.ROLE_DETECTED, requestId,
                "role=" + context.role().tag() + " budgetFraction=" + context.budgetFraction() + " granted=" + granted);

            // ── routing ────────────────────────────────────────────────────
            QueryType queryType = parseQueryType(request.queryType(), requestId);
            List<RouteStep> route = routingTable.route(queryType);
            flowLogger.transition(RequestState.AGENTS_SELECTED, requestId,
                "queryType=" + queryType.tag() + " agents=" + route.stream().map(RouteStep::agentId).toList());

            ResponseMetadata metadata = new ResponseMetadata(queryType.tag(), context.role(),
                context.budgetFraction(), granted, List.of(), List.of());
            if (route.isEmpty()) {
                flowLogger.transition(RequestState.FAILED, requestId, "no route");
                return Mono.just(AnalyticsResponse.failed(requestId,
                    "No agents routed for query_type '" + request.queryType() + "'", elapsedSince(startNanos), metadata));
            }

            CallerContext caller = CallerContext.of(requestId, request.userId(), granted, context);

            // ── fan out ────────────────────────────────────────────────────
            flowLogger.transition(RequestState.EXECUTING, requestId);
            return Flux.fromIterable(route)
                .flatMap(step -> invoke(step, request, caller), maxConcurrency)
                .collectList()
                .doOnNext(outcomes -> flowLogger.transition(RequestState.SYNTHESIZING, requestId))
                .map(outcomes -> ResponseSynthesizer.synthesize(requestId, route, outcomes,
                    elapsedSince(startNanos), metadata))
                .doOnNext(response -> flowLogger.transition(RequestState.COMPLETED, requestId,
                    "status=" + response.status().tag() + " failed=" + response.metadata().agentsFailed()));
        })
        .onErrorResume(e -> {
            flowLogger.failed(requestId, e);
            return Mono.just(AnalyticsResponse.failed(requestId,
                "Request failed: " + e.getMessage(), elapsedSince(startNanos), null));
        })
        .doOnNext(response -> recordTerminal(request, response));
    }

    public AnalyticsSession startSession(String userId) {
        return sessionHistory.startSession(userId);
    }

    public Optional<AnalyticsSession> endSession(String sessionId) {
        return sessionHistory.endSession(sessionId);
    }

    /** Interaction summary for one user, or for every user when {@code userId} is null. */
    public SessionSummary sessionSummary(String userId) {
        return sessionHistory.summary(userId);
    }

    public SystemStatus systemStatus() {
        return new SystemStatus(metricsSink.snapshot(), agentFactory.listAgents(), agentFactory.registeredTypes(),
            Arrays.stream(QueryType.values()).map(QueryType::tag).toList(), sessionHistory.recent());
    }

    // ── per-agent invocation ──────────────────────────────────────────────

    private Mono<AgentOutcome> invoke(RouteStep step, AnalyticsRequest request, CallerContext caller) {
        return Mono.defer(() -> {
            long t0 = System.nanoTime();
            Optional<Agent> resolved = agentFactory.get(step.agentId());
            if (resolved.isEmpty()) {
                return Mono.just(outcome(step, ActionResult.error(AnalyticsErrorCode.AGENT_NOT_FOUND,
                    "No agent instance '" + step.agentId() + "'"), t0));
            }
            Agent agent = resolved.get();

            PermissionCheck check = PermissionGuard.check(agent.listCapabilities(), step.action(), caller.grantedLevel());
            if (check.decision() == PermissionDecision.DENIED) {
                log.warn("[Orchestrator] Permission denied agent={} action={} granted={}",
                         step.agentId(), step.action(), caller.grantedLevel());
                return Mono.just(outcome(step,
                    ActionResult.error(AnalyticsErrorCode.PERMISSION_DENIED, check.message()), t0));
            }
            if (check.decision() == PermissionDecision.CAPABILITY_NOT_FOUND) {
                return Mono.just(outcome(step,
                    ActionResult.error(AnalyticsErrorCode.CAPABILITY_NOT_FOUND, check.message()), t0));
            }

            return Mono.fromCallable(() -> agent.execute(step.action(), request.parameters(), caller))
                .subscribeOn(Schedulers.boundedElastic())
                .switchIfEmpty(Mono.fromSupplier(() -> ActionResult.error(AnalyticsErrorCode.AGENT_EXECUTION_ERROR,
                    "Agent returned no result")))
                .timeout(agentTimeout)
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("[Orchestrator] Timeout agent={} action={} after={}ms",
                             step.agentId(), step.action(), agentTimeout.toMillis());
                    return Mono.just(ActionResult.error(AnalyticsErrorCode.TIMEOUT,
                        "Agent '" + step.agentId() + "' timed out after " + agentTimeout.toMillis() + "ms"));
                })
                .onErrorResume(e -> {
                    log.error("[Orchestrator] Agent={} action={} failed", step.agentId(), step.action(), e);
                    return Mono.just(ActionResult.error(AnalyticsErrorCode.AGENT_EXECUTION_ERROR,
                        "Agent '" + step.agentId() + "' failed: " + e.getMessage()));
                })
                .map(result -> outcome(step, result, t0));
        })
        .doOnNext(o -> metricsSink.recordAgentOutcome(o.agentId(), o.result().success(), o.elapsed()));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private QueryType parseQueryType(String raw, String requestId) {
        Optional<QueryType> parsed = QueryType.fromTag(raw);
        if (parsed.isEmpty()) {
            TraceContextUtil.withMdc(requestId, () ->
                log.warn("[Orchestrator] Unknown query_type={}; routing as {}", raw, QueryType.GENERAL.tag()));
        }
        return parsed.orElse(QueryType.GENERAL);
    }

    private void recordTerminal(AnalyticsRequest request, AnalyticsResponse response) {
        metricsSink.recordRequest(response.status(), response.executionTime());
        Object sessionHint = request.contextHints().get(SESSION_HINT);
        List<String> agentsUsed = response.metadata() != null ? response.metadata().agentsUsed() : List.of();
        sessionHistory.record(new SessionEntry(response.requestId(), request.userId(),
            sessionHint instanceof String ? (String) sessionHint : null, request.queryType(),
            response.status(), agentsUsed, response.executionTime(), Instant.now()));
    }

    private static AgentOutcome outcome(RouteStep step, ActionResult result, long startNanos) {
        return new AgentOutcome(step, result, elapsedSince(startNanos));
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
