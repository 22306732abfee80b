package com.analyticsplatform.analysis.agent;

import com.analyticsplatform.analysis.engine.EnsembleResult;
import com.analyticsplatform.analysis.engine.ModelExecutionEngine;
import com.analyticsplatform.analysis.engine.PredictionResult;
import com.analyticsplatform.analysis.feature.FeatureImputer;
import com.analyticsplatform.analysis.feature.FeatureTable;
import com.analyticsplatform.analysis.model.ModelCatalogEntry;
import com.analyticsplatform.analysis.model.ModelDescriptor;
import com.analyticsplatform.common.agent.AbstractAgent;
import com.analyticsplatform.common.agent.ActionResult;
import com.analyticsplatform.common.agent.CallerContext;
import com.analyticsplatform.common.agent.Parameters;
import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.exception.AnalyticsException;
import com.analyticsplatform.common.permission.PermissionLevel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Agent front of the {@link ModelExecutionEngine}.
 *
 * <p>Feature gaps are only filled when the caller passes {@code impute=true}; the keys filled
 * are reported back as {@code imputed_features}.
 */
public class ModelEngineAgent extends AbstractAgent<ModelEngineAction> {

    public static final String TYPE = "model_engine";

    private final ModelExecutionEngine engine;
    private final GameFeatureResolver resolver;
    private final String defaultModelId;

    public ModelEngineAgent(String agentId, ModelExecutionEngine engine, FeatureTable featureTable,
                            String defaultModelId) {
        super(agentId, TYPE, PermissionLevel.ADMIN, ModelEngineAction.class);
        this.engine = engine;
        this.resolver = new GameFeatureResolver(featureTable);
        this.defaultModelId = defaultModelId;
    }

    @Override
    protected ActionResult perform(ModelEngineAction action, Map<String, Object> params, CallerContext caller) {
        return switch (action) {
            case PREDICT_GAME_OUTCOME -> predictGameOutcome(params);
            case ENSEMBLE_PREDICTION  -> ensemblePrediction(params);
            case MODEL_COMPARISON     -> modelComparison(params);
            case BATCH_PREDICTIONS    -> batchPredictions(params);
            case LIST_MODELS          -> listModels();
            case MODEL_HEALTH_CHECK   -> healthCheck();
        };
    }

    // ── actions ────────────────────────────────────────────────────────────

    private ActionResult predictGameOutcome(Map<String, Object> params) {
        String modelId = singleModelId(params);
        ResolvedGame game = resolver.resolve(params);
        FeatureImputer.Imputed prepared = prepare(params, List.of(modelId), game.features());

        PredictionResult prediction = engine.predict(modelId, prepared.features());
        log.info("[{}] predict modelId={} gameId={} confidence={}",
                 agentId(), modelId, game.gameId(), prediction.confidence());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("game_id", game.gameId());
        payload.put("prediction", prediction);
        payload.put("imputed_features", prepared.imputedKeys());
        payload.put("insights", List.of(describe(prediction)));
        return ActionResult.success(payload);
    }

    private ActionResult ensemblePrediction(Map<String, Object> params) {
        List<String> modelIds = requestedOrAvailable(params);
        List<Double> weights = Parameters.doubleList(params, "weights").orElse(null);
        ResolvedGame game = resolver.resolve(params);
        FeatureImputer.Imputed prepared = prepare(params, modelIds, game.features());

        EnsembleResult result = engine.predictEnsemble(prepared.features(), modelIds, weights);

        List<String> insights = new ArrayList<>();
        if (result.margin() != null) {
            insights.add(String.format(Locale.ROOT, "Ensemble margin: %+.1f points across %d model(s)",
                result.margin(), result.modelIds().size()));
        }
        if (result.winProbability() != null) {
            insights.add(String.format(Locale.ROOT, "Ensemble home win probability: %.1f%%",
                result.winProbability() * 100));
        }
        insights.add(String.format(Locale.ROOT, "Ensemble confidence: %.2f", result.confidence()));
        if (!result.failedModels().isEmpty()) {
            insights.add("Skipped models: " + String.join(", ", result.failedModels().keySet()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("game_id", game.gameId());
        payload.put("ensemble", result);
        payload.put("imputed_features", prepared.imputedKeys());
        payload.put("insights", insights);
        return ActionResult.success(payload);
    }

    private ActionResult modelComparison(Map<String, Object> params) {
        List<String> modelIds = requestedOrAvailable(params);
        ResolvedGame game = resolver.resolve(params);
        FeatureImputer.Imputed prepared = prepare(params, modelIds, game.features());

        Map<String, Object> comparison = new LinkedHashMap<>();
        List<Double> margins = new ArrayList<>();
        List<Double> probabilities = new ArrayList<>();
        for (String modelId : modelIds) {
            try {
                PredictionResult p = engine.predict(modelId, prepared.features());
                comparison.put(modelId, p);
                if (p.margin() != null) margins.add(p.margin());
                if (p.winProbability() != null) probabilities.add(p.winProbability());
            } catch (AnalyticsException e) {
                comparison.put(modelId, Map.of("error_code", e.getCode(), "message", e.getMessage()));
            }
        }

        List<String> insights = new ArrayList<>();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("game_id", game.gameId());
        payload.put("comparison", comparison);
        if (margins.size() > 1) {
            double spread = spread(margins);
            payload.put("margin_spread", spread);
            insights.add(String.format(Locale.ROOT, "Margin models disagree by %.1f points", spread));
        }
        if (probabilities.size() > 1) {
            double spread = spread(probabilities);
            payload.put("probability_spread", spread);
            insights.add(String.format(Locale.ROOT, "Probability models disagree by %.1f%%", spread * 100));
        }
        payload.put("insights", insights);
        return ActionResult.success(payload);
    }

    private ActionResult batchPredictions(Map<String, Object> params) {
        String modelId = singleModelId(params);
        Object raw = params.get("games");
        if (!(raw instanceof Collection<?> games) || games.isEmpty()) {
            return ActionResult.error(AnalyticsErrorCode.INVALID_PARAMETERS,
                "[" + agentId() + "] batch_predictions needs a non-empty 'games' list");
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        int succeeded = 0;
        for (Map<String, Object> gameParams : GameFeatureResolver.gameParameters(games)) {
            Map<String, Object> row = new LinkedHashMap<>();
            try {
                ResolvedGame game = resolver.resolve(gameParams);
                row.put("game_id", game.gameId());
                FeatureImputer.Imputed prepared = prepare(params, List.of(modelId), game.features());
                row.put("prediction", engine.predict(modelId, prepared.features()));
                succeeded++;
            } catch (AnalyticsException e) {
                row.putIfAbsent("game_id", gameParams.getOrDefault("game_id", "unknown"));
                row.put("error_code", e.getCode());
                row.put("message", e.getMessage());
            }
            rows.add(row);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model_id", modelId);
        payload.put("predictions", rows);
        payload.put("succeeded", succeeded);
        payload.put("failed", rows.size() - succeeded);
        payload.put("insights", List.of("Batch: " + succeeded + " of " + rows.size() + " games predicted with " + modelId));
        return ActionResult.success(payload);
    }

    private ActionResult listModels() {
        List<ModelDescriptor> models = engine.listAvailableModels();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("models", models);
        payload.put("count", models.size());
        payload.put("insights", List.of(models.size() + " model(s) available"));
        return ActionResult.success(payload);
    }

    private ActionResult healthCheck() {
        Map<String, String> status = engine.healthCheck();
        boolean healthy = status.values().stream().allMatch("loaded"::equals);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("models", status);
        payload.put("healthy", healthy);
        payload.put("insights", List.of(healthy
            ? "All " + status.size() + " models loaded"
            : "Unhealthy models: " + status.entrySet().stream()
                .filter(e -> !"loaded".equals(e.getValue()))
                .map(Map.Entry::getKey)
                .toList()));
        return ActionResult.success(payload);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private String singleModelId(Map<String, Object> params) {
        return Parameters.string(params, "model_id")
            .orElseGet(() -> {
                List<String> models = Parameters.stringList(params, "models");
                return models.isEmpty() ? defaultModelId : models.get(0);
            });
    }

    private List<String> requestedOrAvailable(Map<String, Object> params) {
        List<String> requested = Parameters.stringList(params, "models");
        if (!requested.isEmpty()) return requested;
        return engine.listAvailableModels().stream().map(ModelDescriptor::id).toList();
    }

    /** Applies imputation only when the caller asked for it. */
    private FeatureImputer.Imputed prepare(Map<String, Object> params, List<String> modelIds,
                                           Map<String, Double> features) {
        if (!Parameters.flag(params, "impute")) {
            return new FeatureImputer.Imputed(features, List.of());
        }
        Set<String> required = new LinkedHashSet<>();
        for (String modelId : modelIds) {
            engine.catalog().entry(modelId).map(ModelCatalogEntry::requiredFeatures).ifPresent(required::addAll);
        }
        return FeatureImputer.impute(features, List.copyOf(required), engine.catalog().featureDefaults());
    }

    private static String describe(PredictionResult p) {
        if (p.margin() != null) {
            return String.format(Locale.ROOT, "Predicted margin: %+.1f points (%s)", p.margin(), p.modelId());
        }
        return String.format(Locale.ROOT, "Home win probability: %.1f%% (%s)", p.winProbability() * 100, p.modelId());
    }

    private static double spread(List<Double> values) {
        double max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double min = values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        return max - min;
    }
}
