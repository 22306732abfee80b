package com.analyticsplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** JSON shape of {@code models.json}. */
public record ModelManifest(
    @JsonProperty("models") List<ModelCatalogEntry> models,
    @JsonProperty("feature_defaults") Map<String, Double> featureDefaults
) {
    public ModelManifest {
        models          = models == null ? List.of() : List.copyOf(models);
        featureDefaults = featureDefaults == null ? Map.of() : Map.copyOf(featureDefaults);
    }
}
