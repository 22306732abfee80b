package com.analyticsplatform.orchestrator.routing;

import java.util.Locale;
import java.util.Optional;

/** Closed set of query types, parsed once from the request's {@code query_type} tag. */
public enum QueryType {
    PREDICTION("prediction"),
    ENSEMBLE("ensemble"),
    MODEL_COMPARISON("model_comparison"),
    BATCH_PREDICTION("batch_prediction"),
    ANALYSIS("analysis"),
    LEARNING("learning"),
    MODELS("models"),
    HEALTH("health"),
    GENERAL("general");

    private final String tag;

    QueryType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /** Empty for null, blank or unrecognized tags. */
    public static Optional<QueryType> fromTag(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (QueryType type : values()) {
            if (type.tag.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
