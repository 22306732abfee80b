package com.analyticsplatform.analysis.engine;

import com.analyticsplatform.analysis.model.ModelTask;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combined output of several models. {@code weights} covers the models that produced a
 * prediction and sums to 1.0; {@code failedModels} maps each skipped modelId to its error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnsembleResult(
    @JsonProperty("models") List<String> modelIds,
    @JsonProperty("weights") Map<String, Double> weights,
    @JsonProperty("margin") Double margin,
    @JsonProperty("win_probability") Double winProbability,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("disagreement") Map<ModelTask, Double> disagreement,
    @JsonProperty("predictions") List<PredictionResult> predictions,
    @JsonProperty("failed_models") Map<String, String> failedModels
) {
    public EnsembleResult {
        modelIds     = List.copyOf(modelIds);
        weights      = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        disagreement = Collections.unmodifiableMap(new LinkedHashMap<>(disagreement));
        predictions  = List.copyOf(predictions);
        failedModels = failedModels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failedModels));
    }

    public EnsembleResult withFailedModels(Map<String, String> failed) {
        return new EnsembleResult(modelIds, weights, margin, winProbability, confidence,
            disagreement, predictions, failed);
    }
}
