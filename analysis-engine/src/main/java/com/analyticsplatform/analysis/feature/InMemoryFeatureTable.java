package com.analyticsplatform.analysis.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryFeatureTable implements FeatureTable {

    private final Map<String, Map<String, Double>> rows;

    public InMemoryFeatureTable(Map<String, Map<String, Double>> rows) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        rows.forEach((id, features) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(features))));
        this.rows = Collections.unmodifiableMap(copy);
    }

    public static InMemoryFeatureTable empty() {
        return new InMemoryFeatureTable(Map.of());
    }

    @Override
    public Optional<Map<String, Double>> lookup(String gameId) {
        return gameId == null ? Optional.empty() : Optional.ofNullable(rows.get(gameId));
    }

    @Override
    public Set<String> gameIds() {
        return rows.keySet();
    }
}
