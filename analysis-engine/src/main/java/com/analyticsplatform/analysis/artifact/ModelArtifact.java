package com.analyticsplatform.analysis.artifact;

import java.util.Map;

/**
 * A deserialized, read-only model. {@link #predict} must be safe for concurrent callers.
 */
public interface ModelArtifact extends AutoCloseable {

    /** Raw model output for the given named features. */
    double predict(Map<String, Double> features);

    @Override
    default void close() {
    }
}
