package com.analyticsplatform.analysis.registry;

import com.analyticsplatform.analysis.artifact.ModelArtifact;
import com.analyticsplatform.analysis.model.ModelCatalogEntry;

import java.time.Instant;
import java.util.Map;

/** A loaded model. Shared read-only across requests once published by the registry. */
public record ModelHandle(
    String modelId,
    ModelCatalogEntry entry,
    ModelArtifact artifact,
    Instant loadedAt
) {
    public double predictRaw(Map<String, Double> features) {
        return artifact.predict(features);
    }
}
