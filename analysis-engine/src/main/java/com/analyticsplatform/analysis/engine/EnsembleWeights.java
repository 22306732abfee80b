package com.analyticsplatform.analysis.engine;

import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.exception.AnalyticsException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless weight normalization for ensembles.
 *
 * <pre>
 *   w_i = raw_i / Σ raw        when Σ raw &gt; 0
 *   w_i = 1 / n                otherwise (every raw weight is zero)
 * </pre>
 *
 * Negative or non-finite raw weights are rejected. The result always sums to 1.0 (±1e-9)
 * for a non-empty id list.
 */
public final class EnsembleWeights {

    private EnsembleWeights() {}

    /**
     * Pairs explicit caller weights with model ids by position.
     */
    public static Map<String, Double> explicit(List<String> modelIds, List<Double> weights) {
        if (weights.size() != modelIds.size()) {
            throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS,
                "Got " + weights.size() + " weights for " + modelIds.size() + " models");
        }
        Map<String, Double> raw = new LinkedHashMap<>();
        for (int i = 0; i < modelIds.size(); i++) {
            raw.put(modelIds.get(i), weights.get(i));
        }
        return raw;
    }

    /**
     * Normalizes {@code raw} restricted to {@code modelIds}. Ids missing from {@code raw}
     * count as zero.
     */
    public static Map<String, Double> normalize(List<String> modelIds, Map<String, Double> raw) {
        if (modelIds.isEmpty()) {
            throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS, "No models to weight");
        }
        double total = 0.0;
        for (String id : modelIds) {
            double w = raw.getOrDefault(id, 0.0);
            if (!Double.isFinite(w) || w < 0.0) {
                throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS,
                    "Weight for model '" + id + "' must be a non-negative number, got " + w);
            }
            total += w;
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        for (String id : modelIds) {
            double w = total > 0.0 ? raw.getOrDefault(id, 0.0) / total : 1.0 / modelIds.size();
            normalized.put(id, w);
        }
        return normalized;
    }
}
