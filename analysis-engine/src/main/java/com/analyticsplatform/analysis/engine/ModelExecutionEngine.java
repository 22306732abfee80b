package com.analyticsplatform.analysis.engine;

import com.analyticsplatform.analysis.model.ModelCatalog;
import com.analyticsplatform.analysis.model.ModelCatalogEntry;
import com.analyticsplatform.analysis.model.ModelDescriptor;
import com.analyticsplatform.analysis.model.ModelTask;
import com.analyticsplatform.analysis.registry.ModelHandle;
import com.analyticsplatform.analysis.registry.ModelRegistry;
import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.exception.AnalyticsException;
import com.analyticsplatform.common.exception.FeatureMismatchException;
import com.analyticsplatform.common.exception.ModelNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Single and ensemble inference over the models in a {@link ModelCatalog}.
 *
 * <h3>Per-model confidence</h3>
 * <pre>
 *   margin          → min(0.95, 0.6 + min(0.3, |margin| / 20))
 *   win probability → max(p, 1 − p)
 *   numeric overflow (non-finite or out of task range) → clamp, confidence = 0.1
 * </pre>
 *
 * <h3>Ensemble</h3>
 * Each named model is run independently. Models that fail are
 * skipped and reported in {@code failed_models}; weights are normalized over the models that
 * succeeded. Default weights are the catalog's historical accuracy. If no model succeeds the
 * first failure is rethrown.
 *
 * <p>The engine never fills in a missing feature.
 */
public class ModelExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ModelExecutionEngine.class);

    static final double OVERFLOW_CONFIDENCE = 0.1;

    private final ModelCatalog catalog;
    private final ModelRegistry registry;
    private final EnsembleStrategy ensembleStrategy;

    public ModelExecutionEngine(ModelCatalog catalog, ModelRegistry registry, EnsembleStrategy ensembleStrategy) {
        this.catalog = catalog;
        this.registry = registry;
        this.ensembleStrategy = ensembleStrategy;
    }

    /** Catalog models not marked unavailable, ordered by id. No side-effects. */
    public List<ModelDescriptor> listAvailableModels() {
        return catalog.entries().stream()
            .filter(e -> !registry.isUnavailable(e.id()))
            .map(catalog::describe)
            .toList();
    }

    public PredictionResult predict(String modelId, Map<String, Double> features) {
        ModelCatalogEntry entry = catalog.entry(modelId)
            .orElseThrow(() -> new ModelNotFoundException(String.valueOf(modelId), "not in catalog"));

        List<String> missing = missingFeatures(entry, features);
        if (!missing.isEmpty()) {
            throw new FeatureMismatchException(modelId, missing);
        }

        ModelHandle handle = registry.handle(modelId);
        double raw = handle.predictRaw(features);
        return toPrediction(entry, raw);
    }

    /**
     * @param weights explicit weights aligned with {@code modelIds}, or null for
     *                accuracy-normalized defaults
     */
    public EnsembleResult predictEnsemble(Map<String, Double> features, List<String> modelIds, List<Double> weights) {
        if (modelIds == null || modelIds.isEmpty()) {
            throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS, "Ensemble needs at least one model");
        }
        if (new LinkedHashSet<>(modelIds).size() != modelIds.size()) {
            throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS, "Duplicate model ids in " + modelIds);
        }

        Map<String, Double> rawWeights = weights != null
            ? EnsembleWeights.explicit(modelIds, weights)
            : catalog.historicalAccuracies(modelIds);

        List<PredictionResult> predictions = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        AnalyticsException firstFailure = null;

        for (String modelId : modelIds) {
            try {
                predictions.add(predict(modelId, features));
            } catch (AnalyticsException e) {
                log.warn("[ModelEngine] Ensemble member modelId={} skipped code={} message={}",
                         modelId, e.getCode(), e.getMessage());
                failed.put(modelId, e.getCode() + ": " + e.getMessage());
                if (firstFailure == null) firstFailure = e;
            }
        }

        if (predictions.isEmpty()) {
            throw firstFailure;
        }

        List<String> succeeded = predictions.stream().map(PredictionResult::modelId).toList();
        Map<String, Double> normalized = EnsembleWeights.normalize(succeeded, rawWeights);
        return ensembleStrategy.combine(predictions, normalized).withFailedModels(failed);
    }

    /**
     * Forces a load of every catalog model and reports {@code loaded}, {@code not_found} or
     * {@code unavailable} per modelId.
     */
    public Map<String, String> healthCheck() {
        Map<String, String> status = new LinkedHashMap<>();
        for (ModelCatalogEntry entry : catalog.entries()) {
            try {
                registry.handle(entry.id());
                status.put(entry.id(), "loaded");
            } catch (ModelNotFoundException e) {
                status.put(entry.id(), "not_found");
            } catch (AnalyticsException e) {
                status.put(entry.id(), "unavailable");
            }
        }
        return status;
    }

    public ModelCatalog catalog() {
        return catalog;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static List<String> missingFeatures(ModelCatalogEntry entry, Map<String, Double> features) {
        List<String> missing = new ArrayList<>();
        for (String required : entry.requiredFeatures()) {
            if (features == null || features.get(required) == null) {
                missing.add(required);
            }
        }
        return missing;
    }

    private PredictionResult toPrediction(ModelCatalogEntry entry, double raw) {
        ModelTask task = entry.task();
        boolean overflow = !task.inRange(raw);
        double value = overflow ? task.clamp(raw) : raw;
        if (overflow) {
            log.warn("[ModelEngine] Numeric overflow modelId={} raw={} clampedTo={}", entry.id(), raw, value);
        }

        if (task == ModelTask.MARGIN) {
            double confidence = overflow
                ? OVERFLOW_CONFIDENCE
                : Math.min(0.95, 0.6 + Math.min(0.3, Math.abs(value) / 20.0));
            return PredictionResult.margin(entry.id(), value, confidence, overflow);
        }
        double confidence = overflow ? OVERFLOW_CONFIDENCE : Math.max(value, 1.0 - value);
        return PredictionResult.winProbability(entry.id(), value, confidence, overflow);
    }
}
