package com.analyticsplatform.orchestrator.routing;

import com.analyticsplatform.analysis.agent.InsightGeneratorAgent;
import com.analyticsplatform.analysis.agent.LearningNavigatorAgent;
import com.analyticsplatform.analysis.agent.ModelEngineAgent;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static, declarative mapping of {@link QueryType} to an ordered list of candidate agents.
 * This is the only place agent instances get wired into request handling.
 *
 * <p>A query type without its own route uses the {@link QueryType#GENERAL} route. An agent
 * instance may appear at most once per route, because results are keyed by agent id.
 */
public class RoutingTable {

    public static final String MODEL_ENGINE       = ModelEngineAgent.TYPE;
    public static final String INSIGHT_GENERATOR  = InsightGeneratorAgent.TYPE;
    public static final String LEARNING_NAVIGATOR = LearningNavigatorAgent.TYPE;

    private final Map<QueryType, List<RouteStep>> routes;

    public RoutingTable(Map<QueryType, List<RouteStep>> routes) {
        Map<QueryType, List<RouteStep>> copy = new EnumMap<>(QueryType.class);
        routes.forEach((type, steps) -> {
            Set<String> seen = new HashSet<>();
            for (RouteStep step : steps) {
                if (!seen.add(step.agentId())) {
                    throw new IllegalArgumentException("Route " + type + " lists agent '" + step.agentId() + "' twice");
                }
            }
            copy.put(type, List.copyOf(steps));
        });
        this.routes = Collections.unmodifiableMap(copy);
    }

    public static RoutingTable defaults() {
        Map<QueryType, List<RouteStep>> r = new EnumMap<>(QueryType.class);
        r.put(QueryType.PREDICTION, List.of(
            RouteStep.of(MODEL_ENGINE, "predict_game_outcome"),
            RouteStep.of(INSIGHT_GENERATOR, "generate_analysis")));
        r.put(QueryType.ENSEMBLE, List.of(
            RouteStep.of(MODEL_ENGINE, "ensemble_prediction"),
            RouteStep.of(INSIGHT_GENERATOR, "generate_analysis")));
        r.put(QueryType.MODEL_COMPARISON, List.of(
            RouteStep.of(MODEL_ENGINE, "model_comparison")));
        r.put(QueryType.BATCH_PREDICTION, List.of(
            RouteStep.of(MODEL_ENGINE, "batch_predictions"),
            RouteStep.of(INSIGHT_GENERATOR, "statistical_analysis")));
        r.put(QueryType.ANALYSIS, List.of(
            RouteStep.of(INSIGHT_GENERATOR, "generate_analysis"),
            RouteStep.of(LEARNING_NAVIGATOR, "explain_concepts")));
        r.put(QueryType.LEARNING, List.of(
            RouteStep.of(LEARNING_NAVIGATOR, "guide_learning_path")));
        r.put(QueryType.MODELS, List.of(
            RouteStep.of(MODEL_ENGINE, "list_models")));
        r.put(QueryType.HEALTH, List.of(
            RouteStep.of(MODEL_ENGINE, "model_health_check")));
        r.put(QueryType.GENERAL, List.of(
            RouteStep.of(LEARNING_NAVIGATOR, "recommend_content")));
        return new RoutingTable(r);
    }

    public List<RouteStep> route(QueryType type) {
        List<RouteStep> steps = routes.get(type);
        if (steps != null) return steps;
        return routes.getOrDefault(QueryType.GENERAL, List.of());
    }

    public Map<QueryType, List<RouteStep>> routes() {
        return routes;
    }
}
