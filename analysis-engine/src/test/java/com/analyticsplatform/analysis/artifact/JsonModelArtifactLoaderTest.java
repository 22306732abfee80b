package com.analyticsplatform.analysis.artifact;

import com.analyticsplatform.analysis.model.ModelCatalogEntry;
import com.analyticsplatform.analysis.model.ModelTask;
import com.analyticsplatform.common.exception.ModelLoadFailureException;
import com.analyticsplatform.common.exception.ModelNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonModelArtifactLoaderTest {

    @TempDir
    Path dir;

    private JsonModelArtifactLoader loader;

    @BeforeEach
    void setUp() {
        loader = new JsonModelArtifactLoader(dir, new ObjectMapper());
    }

    @Test
    @DisplayName("identity link: intercept + Σ coefficient × feature")
    void identityModel() throws Exception {
        Files.writeString(dir.resolve("ridge.json"),
            "{\"intercept\": 2.5, \"link\": \"identity\", \"coefficients\": {\"home_elo\": 0.02, \"away_elo\": -0.02}}");

        ModelArtifact artifact = loader.load(entry("ridge.json", List.of("home_elo", "away_elo")));

        assertEquals(2.5 + 0.02 * 1800 - 0.02 * 1700,
            artifact.predict(Map.of("home_elo", 1800.0, "away_elo", 1700.0)), 1e-9);
    }

    @Test
    @DisplayName("logistic link maps z = 0 to 0.5")
    void logisticModel() throws Exception {
        Files.writeString(dir.resolve("logit.json"),
            "{\"intercept\": 0.0, \"link\": \"logistic\", \"coefficients\": {\"home_elo\": 0.01, \"away_elo\": -0.01}}");

        ModelArtifact artifact = loader.load(entry("logit.json", List.of("home_elo", "away_elo")));

        assertEquals(0.5, artifact.predict(Map.of("home_elo", 1600.0, "away_elo", 1600.0)), 1e-12);
    }

    @Test
    @DisplayName("absent file → ModelNotFound")
    void missingFile() {
        assertThrows(ModelNotFoundException.class, () -> loader.load(entry("xgb_v2.json", List.of())));
    }

    @Test
    @DisplayName("unreadable file → ModelLoadFailure")
    void corruptFile() throws Exception {
        Files.writeString(dir.resolve("broken.json"), "{not json");
        assertThrows(ModelLoadFailureException.class, () -> loader.load(entry("broken.json", List.of())));
    }

    @Test
    @DisplayName("coefficient for an undeclared feature → ModelLoadFailure")
    void undeclaredFeature() throws Exception {
        Files.writeString(dir.resolve("ridge.json"),
            "{\"intercept\": 0.0, \"coefficients\": {\"home_elo\": 0.02, \"weather\": 1.0}}");
        ModelLoadFailureException e = assertThrows(ModelLoadFailureException.class,
            () -> loader.load(entry("ridge.json", List.of("home_elo"))));
        assertTrue(e.getMessage().contains("weather"));
    }

    private static ModelCatalogEntry entry(String artifact, List<String> features) {
        return ModelCatalogEntry.of("model", ModelTask.MARGIN, artifact, features, List.of());
    }
}
