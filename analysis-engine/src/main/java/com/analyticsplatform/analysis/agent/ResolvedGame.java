package com.analyticsplatform.analysis.agent;

import java.util.Map;

public record ResolvedGame(String gameId, Map<String, Double> features) {}
