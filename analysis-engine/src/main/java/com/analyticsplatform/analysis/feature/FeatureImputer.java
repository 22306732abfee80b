package com.analyticsplatform.analysis.feature;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit, caller-requested gap filling: copies {@code features} and fills each missing
 * required key from {@code defaults}. Keys without a default stay missing.
 */
public final class FeatureImputer {

    public record Imputed(Map<String, Double> features, List<String> imputedKeys) {}

    private FeatureImputer() {}

    public static Imputed impute(Map<String, Double> features, List<String> required, Map<String, Double> defaults) {
        Map<String, Double> out = new LinkedHashMap<>(features);
        List<String> imputed = new ArrayList<>();
        for (String key : required) {
            if (out.get(key) == null && defaults.containsKey(key)) {
                out.put(key, defaults.get(key));
                imputed.add(key);
            }
        }
        return new Imputed(out, imputed);
    }
}
