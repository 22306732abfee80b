package com.analyticsplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One model as declared in the manifest. {@code accuracyHistory} is ordered oldest first.
 */
public record ModelCatalogEntry(
    @JsonProperty("id") String id,
    @JsonProperty("task") ModelTask task,
    @JsonProperty("artifact") String artifact,
    @JsonProperty("required_features") List<String> requiredFeatures,
    @JsonProperty("accuracy_history") List<Double> accuracyHistory,
    @JsonProperty("version") String version,
    @JsonProperty("description") String description
) {
    public ModelCatalogEntry {
        requiredFeatures = requiredFeatures == null ? List.of() : List.copyOf(requiredFeatures);
        accuracyHistory  = accuracyHistory == null ? List.of() : List.copyOf(accuracyHistory);
    }

    public static ModelCatalogEntry of(String id, ModelTask task, String artifact,
                                       List<String> requiredFeatures, List<Double> accuracyHistory) {
        return new ModelCatalogEntry(id, task, artifact, requiredFeatures, accuracyHistory, "1", null);
    }
}
