package com.analyticsplatform.analysis.engine;

import com.analyticsplatform.analysis.model.ModelTask;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of a single model. Exactly one of {@code margin} and {@code winProbability} is set,
 * according to {@code task}. {@code clamped} marks a numeric overflow that was clamped into
 * the task's range.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PredictionResult(
    @JsonProperty("model_id") String modelId,
    @JsonProperty("task") ModelTask task,
    @JsonProperty("margin") Double margin,
    @JsonProperty("win_probability") Double winProbability,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("clamped") boolean clamped
) {
    public static PredictionResult margin(String modelId, double margin, double confidence, boolean clamped) {
        return new PredictionResult(modelId, ModelTask.MARGIN, margin, null, confidence, clamped);
    }

    public static PredictionResult winProbability(String modelId, double probability, double confidence, boolean clamped) {
        return new PredictionResult(modelId, ModelTask.WIN_PROBABILITY, null, probability, confidence, clamped);
    }

    /** The value this model produced for its own task. */
    public double value() {
        return task == ModelTask.MARGIN ? margin : winProbability;
    }
}
