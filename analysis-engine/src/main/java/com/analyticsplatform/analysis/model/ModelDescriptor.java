package com.analyticsplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Public view of a catalog entry, as returned by {@code listAvailableModels()}. */
public record ModelDescriptor(
    @JsonProperty("id") String id,
    @JsonProperty("task") ModelTask task,
    @JsonProperty("required_features") List<String> requiredFeatures,
    @JsonProperty("historical_accuracy") double historicalAccuracy,
    @JsonProperty("version") String version,
    @JsonProperty("description") String description
) {
    public ModelDescriptor {
        requiredFeatures = requiredFeatures == null ? List.of() : List.copyOf(requiredFeatures);
    }
}
