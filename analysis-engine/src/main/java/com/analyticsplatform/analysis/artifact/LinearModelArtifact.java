package com.analyticsplatform.analysis.artifact;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Linear model serialized as JSON.
 *
 * <pre>
 *   z   = intercept + Σ coefficient[f] × feature[f]
 *   raw = z                 (link = identity)
 *   raw = 1 / (1 + e^(−z))  (link = logistic)
 * </pre>
 */
public record LinearModelArtifact(
    @JsonProperty("intercept") double intercept,
    @JsonProperty("coefficients") Map<String, Double> coefficients,
    @JsonProperty("link") Link link
) implements ModelArtifact {

    public enum Link {
        @JsonProperty("identity") IDENTITY,
        @JsonProperty("logistic") LOGISTIC
    }

    public LinearModelArtifact {
        coefficients = coefficients == null ? Map.of() : Map.copyOf(coefficients);
        link = link == null ? Link.IDENTITY : link;
    }

    @Override
    public double predict(Map<String, Double> features) {
        double z = intercept;
        for (Map.Entry<String, Double> c : coefficients.entrySet()) {
            Double value = features.get(c.getKey());
            if (value != null) {
                z += c.getValue() * value;
            }
        }
        return link == Link.LOGISTIC ? 1.0 / (1.0 + Math.exp(-z)) : z;
    }
}
