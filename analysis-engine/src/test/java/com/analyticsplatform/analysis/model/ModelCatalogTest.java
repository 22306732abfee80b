package com.analyticsplatform.analysis.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogTest {

    private static final ModelCatalogEntry RIDGE = ModelCatalogEntry.of("ridge_model_2025", ModelTask.MARGIN,
        "ridge.json", List.of("home_elo"), List.of(0.50, 0.60, 0.70, 0.80));

    @Test
    @DisplayName("accuracy is the mean of the last N entries")
    void windowedAccuracy() {
        assertEquals(0.70, new ModelCatalog(List.of(RIDGE), Map.of(), 3).historicalAccuracy(RIDGE), 1e-12);
        assertEquals(0.80, new ModelCatalog(List.of(RIDGE), Map.of(), 1).historicalAccuracy(RIDGE), 1e-12);
    }

    @Test
    @DisplayName("window ≤ 0 or larger than history uses every entry")
    void fullHistory() {
        assertEquals(0.65, new ModelCatalog(List.of(RIDGE), Map.of(), 0).historicalAccuracy(RIDGE), 1e-12);
        assertEquals(0.65, new ModelCatalog(List.of(RIDGE), Map.of(), 10).historicalAccuracy(RIDGE), 1e-12);
    }

    @Test
    @DisplayName("empty history scores 0")
    void emptyHistory() {
        ModelCatalogEntry fresh = ModelCatalogEntry.of("fresh", ModelTask.MARGIN, "f.json", List.of(), List.of());
        assertEquals(0.0, new ModelCatalog(List.of(fresh), Map.of(), 3).historicalAccuracy(fresh));
    }

    @Test
    @DisplayName("duplicate ids are rejected")
    void duplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> new ModelCatalog(List.of(RIDGE, RIDGE), Map.of(), 3));
    }

    @Test
    @DisplayName("missing manifest → empty catalog")
    void missingManifest(@TempDir Path dir) {
        ModelCatalog catalog = ModelCatalog.load(dir.resolve("models.json"), new ObjectMapper(), 3);
        assertTrue(catalog.entries().isEmpty());
    }

    @Test
    @DisplayName("manifest is read with tasks, features, history and defaults")
    void loadManifest(@TempDir Path dir) throws Exception {
        Path manifest = dir.resolve("models.json");
        Files.writeString(manifest, """
            {
              "models": [
                {"id": "xgb_v2", "task": "margin", "artifact": "xgb_v2.json",
                 "required_features": ["home_elo", "away_elo"], "accuracy_history": [0.58, 0.60]},
                {"id": "logistic_win_2025", "task": "win_probability", "artifact": "logit.json",
                 "required_features": ["home_elo"], "accuracy_history": [0.7]}
              ],
              "feature_defaults": {"home_elo": 1500.0}
            }
            """);

        ModelCatalog catalog = ModelCatalog.load(manifest, new ObjectMapper(), 3);

        assertEquals(2, catalog.entries().size());
        assertEquals(ModelTask.WIN_PROBABILITY, catalog.entry("logistic_win_2025").orElseThrow().task());
        assertEquals(0.59, catalog.historicalAccuracy(catalog.entry("xgb_v2").orElseThrow()), 1e-12);
        assertEquals(1500.0, catalog.featureDefaults().get("home_elo"));
        assertEquals(List.of("xgb_v2"),
            List.copyOf(catalog.historicalAccuracies(List.of("xgb_v2", "unknown")).keySet()));
    }
}
