package com.analyticsplatform.analysis.engine;

import com.analyticsplatform.common.exception.AnalyticsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EnsembleWeightsTest {

    @Test
    @DisplayName("normalized weights sum to 1 for random non-negative inputs")
    void randomInputs_sumToOne() {
        Random random = new Random(7);
        for (int run = 0; run < 500; run++) {
            int n = 1 + random.nextInt(8);
            List<String> ids = new ArrayList<>();
            Map<String, Double> raw = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                String id = "m" + i;
                ids.add(id);
                raw.put(id, random.nextInt(4) == 0 ? 0.0 : random.nextDouble() * 10);
            }
            Map<String, Double> w = EnsembleWeights.normalize(ids, raw);
            assertEquals(1.0, w.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-6, "run " + run);
            assertTrue(w.values().stream().allMatch(v -> v >= 0.0));
        }
    }

    @Test
    @DisplayName("all-zero weights → equal weights")
    void allZero_equal() {
        Map<String, Double> w = EnsembleWeights.normalize(List.of("a", "b", "c", "d"), Map.of("a", 0.0, "b", 0.0));
        w.values().forEach(v -> assertEquals(0.25, v, 1e-12));
    }

    @Test
    @DisplayName("proportions are preserved")
    void proportional() {
        Map<String, Double> w = EnsembleWeights.normalize(List.of("ridge", "xgb"), Map.of("ridge", 0.6, "xgb", 0.4));
        assertEquals(0.6, w.get("ridge"), 1e-12);
        assertEquals(0.4, w.get("xgb"), 1e-12);
    }

    @Test
    @DisplayName("negative or non-finite weight → AnalyticsException")
    void invalidWeights() {
        assertThrows(AnalyticsException.class,
            () -> EnsembleWeights.normalize(List.of("a", "b"), Map.of("a", -1.0, "b", 2.0)));
        assertThrows(AnalyticsException.class,
            () -> EnsembleWeights.normalize(List.of("a"), Map.of("a", Double.NaN)));
        assertThrows(AnalyticsException.class,
            () -> EnsembleWeights.normalize(List.of(), Map.of()));
    }
}
