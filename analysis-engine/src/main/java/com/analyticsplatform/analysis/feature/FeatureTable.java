package com.analyticsplatform.analysis.feature;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Row records keyed by game id. Lookup returns a named-feature map, or empty. */
public interface FeatureTable {

    Optional<Map<String, Double>> lookup(String gameId);

    Set<String> gameIds();
}
