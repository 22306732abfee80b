package com.analyticsplatform.analysis.engine;

import java.util.List;
import java.util.Map;

/**
 * Combines per-model predictions into one {@link EnsembleResult}.
 */
public interface EnsembleStrategy {

    /**
     * @param predictions one successful prediction per model, non-empty
     * @param weights     modelId → weight, already normalized to sum to 1.0 over
     *                    {@code predictions}
     */
    EnsembleResult combine(List<PredictionResult> predictions, Map<String, Double> weights);
}
