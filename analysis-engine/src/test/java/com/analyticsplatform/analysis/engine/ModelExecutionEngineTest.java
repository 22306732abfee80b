package com.analyticsplatform.analysis.engine;

import com.analyticsplatform.analysis.StubModelLoader;
import com.analyticsplatform.analysis.model.ModelCatalog;
import com.analyticsplatform.analysis.model.ModelCatalogEntry;
import com.analyticsplatform.analysis.model.ModelDescriptor;
import com.analyticsplatform.analysis.model.ModelTask;
import com.analyticsplatform.analysis.registry.ModelRegistry;
import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.exception.AnalyticsException;
import com.analyticsplatform.common.exception.FeatureMismatchException;
import com.analyticsplatform.common.exception.ModelLoadFailureException;
import com.analyticsplatform.common.exception.ModelNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelExecutionEngineTest {

    private static final List<String> ELO = List.of("home_elo", "away_elo");
    private static final Map<String, Double> FEATURES = Map.of("home_elo", 1820.0, "away_elo", 1765.0);

    private static final ModelCatalog CATALOG = new ModelCatalog(List.of(
        ModelCatalogEntry.of("ridge_model_2025", ModelTask.MARGIN, "ridge.json", ELO, List.of(0.6)),
        ModelCatalogEntry.of("xgb_v2", ModelTask.MARGIN, "xgb.json", ELO, List.of(0.4)),
        ModelCatalogEntry.of("logistic_win", ModelTask.WIN_PROBABILITY, "logit.json", ELO, List.of(0.7)),
        ModelCatalogEntry.of("wild_margin", ModelTask.MARGIN, "wild.json", ELO, List.of(0.5)),
        ModelCatalogEntry.of("wilder_margin", ModelTask.MARGIN, "wilder.json", ELO, List.of(0.5)),
        ModelCatalogEntry.of("broken", ModelTask.MARGIN, "broken.json", ELO, List.of(0.5))
    ), Map.of("home_elo", 1500.0, "away_elo", 1500.0), 3);

    private StubModelLoader loader;
    private ModelRegistry registry;
    private ModelExecutionEngine engine;

    @BeforeEach
    void setUp() {
        loader = new StubModelLoader()
            .constant("ridge_model_2025", 10.0)
            .constant("xgb_v2", 5.0)
            .constant("logistic_win", 0.999)
            .constant("wild_margin", 120.0)
            .constant("wilder_margin", 1e7)
            .with("broken", () -> { throw new ModelLoadFailureException("broken", "corrupt", null); });
        registry = new ModelRegistry(CATALOG, loader);
        engine = new ModelExecutionEngine(CATALOG, registry, new WeightedMeanEnsembleStrategy());
    }

    // ── predict() ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("predict()")
    class PredictTests {

        @Test
        @DisplayName("margin prediction carries value and confidence")
        void marginPrediction() {
            PredictionResult p = engine.predict("ridge_model_2025", FEATURES);
            assertEquals(ModelTask.MARGIN, p.task());
            assertEquals(10.0, p.margin());
            assertNull(p.winProbability());
            assertEquals(0.9, p.confidence(), 1e-9);
            assertFalse(p.clamped());
        }

        @Test
        @DisplayName("missing feature → FeatureMismatch, never zero-filled, model not loaded")
        void missingFeature() {
            FeatureMismatchException e = assertThrows(FeatureMismatchException.class,
                () -> engine.predict("ridge_model_2025", Map.of("home_elo", 1820.0)));
            assertEquals(List.of("away_elo"), e.getMissingFeatures());
            assertEquals(AnalyticsErrorCode.FEATURE_MISMATCH, e.getCode());
            assertEquals(0, loader.calls("ridge_model_2025"));
        }

        @Test
        @DisplayName("null feature value counts as missing")
        void nullFeature() {
            Map<String, Double> features = new HashMap<>(FEATURES);
            features.put("away_elo", null);
            assertThrows(FeatureMismatchException.class, () -> engine.predict("ridge_model_2025", features));
        }

        @Test
        @DisplayName("output outside the task range is clamped with confidence 0.1")
        void overflowClamped() {
            PredictionResult p = engine.predict("wild_margin", FEATURES);
            assertEquals(70.0, p.margin());
            assertTrue(p.clamped());
            assertEquals(ModelExecutionEngine.OVERFLOW_CONFIDENCE, p.confidence());
        }

        @Test
        @DisplayName("probability confidence is max(p, 1 − p)")
        void probabilityConfidence() {
            PredictionResult p = engine.predict("logistic_win", FEATURES);
            assertEquals(0.999, p.winProbability(), 1e-12);
            assertEquals(0.999, p.confidence(), 1e-12);
        }

        @Test
        @DisplayName("absent xgb_v2 artifact → ModelNotFound; other models unaffected")
        void missingArtifact_isolated() {
            StubModelLoader partial = new StubModelLoader().constant("ridge_model_2025", 10.0);
            ModelExecutionEngine partialEngine = new ModelExecutionEngine(CATALOG,
                new ModelRegistry(CATALOG, partial), new WeightedMeanEnsembleStrategy());

            assertThrows(ModelNotFoundException.class, () -> partialEngine.predict("xgb_v2", FEATURES));
            assertEquals(10.0, partialEngine.predict("ridge_model_2025", FEATURES).margin());
        }

        @Test
        @DisplayName("id outside the catalog → ModelNotFound")
        void unknownModel() {
            assertThrows(ModelNotFoundException.class, () -> engine.predict("lstm_v9", FEATURES));
        }
    }

    // ── predictEnsemble() ──────────────────────────────────────────────────

    @Nested
    @DisplayName("predictEnsemble()")
    class EnsembleTests {

        @Test
        @DisplayName("accuracy 0.6 / 0.4 → weights 0.6 / 0.4 and margin 0.6a + 0.4b")
        void accuracyWeighted() {
            EnsembleResult result = engine.predictEnsemble(FEATURES, List.of("ridge_model_2025", "xgb_v2"), null);

            assertEquals(0.6, result.weights().get("ridge_model_2025"), 1e-9);
            assertEquals(0.4, result.weights().get("xgb_v2"), 1e-9);
            assertEquals(0.6 * 10.0 + 0.4 * 5.0, result.margin(), 1e-9);
            assertNull(result.winProbability());

            double variance = 0.6 * 2.0 * 2.0 + 0.4 * 3.0 * 3.0;
            assertEquals(1.0 - variance / ModelTask.MARGIN.maxVariance(), result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("explicit weights override accuracy")
        void explicitWeights() {
            EnsembleResult result = engine.predictEnsemble(FEATURES,
                List.of("ridge_model_2025", "xgb_v2"), List.of(1.0, 3.0));
            assertEquals(0.25, result.weights().get("ridge_model_2025"), 1e-9);
            assertEquals(0.25 * 10.0 + 0.75 * 5.0, result.margin(), 1e-9);
        }

        @Test
        @DisplayName("weight count mismatch → INVALID_PARAMETERS")
        void weightMismatch() {
            AnalyticsException e = assertThrows(AnalyticsException.class, () -> engine.predictEnsemble(FEATURES,
                List.of("ridge_model_2025", "xgb_v2"), List.of(1.0)));
            assertEquals(AnalyticsErrorCode.INVALID_PARAMETERS, e.getCode());
        }

        @Test
        @DisplayName("empty or duplicate model list → INVALID_PARAMETERS")
        void badModelList() {
            assertEquals(AnalyticsErrorCode.INVALID_PARAMETERS, assertThrows(AnalyticsException.class,
                () -> engine.predictEnsemble(FEATURES, List.of(), null)).getCode());
            assertEquals(AnalyticsErrorCode.INVALID_PARAMETERS, assertThrows(AnalyticsException.class,
                () -> engine.predictEnsemble(FEATURES, List.of("xgb_v2", "xgb_v2"), null)).getCode());
        }

        @Test
        @DisplayName("members that all overflow agree at the bound yet report overflow confidence")
        void allMembersClamped() {
            EnsembleResult result = engine.predictEnsemble(FEATURES, List.of("wild_margin", "wilder_margin"), null);
            assertEquals(70.0, result.margin(), 1e-12);
            assertTrue(result.predictions().stream().allMatch(PredictionResult::clamped));
            assertTrue(result.confidence() <= ModelExecutionEngine.OVERFLOW_CONFIDENCE);
        }

        @Test
        @DisplayName("ensemble probability is clamped to [0.01, 0.99]")
        void probabilityClamped() {
            EnsembleResult result = engine.predictEnsemble(FEATURES, List.of("logistic_win"), null);
            assertEquals(0.99, result.winProbability(), 1e-12);
        }

        @Test
        @DisplayName("mixed tasks produce both a margin and a probability")
        void mixedTasks() {
            EnsembleResult result = engine.predictEnsemble(FEATURES, List.of("ridge_model_2025", "logistic_win"), null);
            assertNotNull(result.margin());
            assertNotNull(result.winProbability());
            assertEquals(1.0, result.weights().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-6);
        }

        @Test
        @DisplayName("failed member is skipped and weights renormalize over the rest")
        void failedMemberSkipped() {
            EnsembleResult result = engine.predictEnsemble(FEATURES, List.of("ridge_model_2025", "broken"), null);
            assertEquals(List.of("ridge_model_2025"), result.modelIds());
            assertEquals(1.0, result.weights().get("ridge_model_2025"), 1e-9);
            assertTrue(result.failedModels().containsKey("broken"));
            assertEquals(10.0, result.margin(), 1e-9);
        }

        @Test
        @DisplayName("every member failing rethrows the first failure")
        void allFail() {
            assertThrows(FeatureMismatchException.class, () -> engine.predictEnsemble(
                Map.of("home_elo", 1.0), List.of("ridge_model_2025", "xgb_v2"), null));
        }
    }

    // ── listing and health ─────────────────────────────────────────────────

    @Nested
    @DisplayName("listAvailableModels() / healthCheck()")
    class ListingTests {

        @Test
        @DisplayName("listing is ordered by id and idempotent")
        void listingIdempotent() {
            List<ModelDescriptor> first = engine.listAvailableModels();
            List<ModelDescriptor> second = engine.listAvailableModels();
            assertEquals(first, second);
            assertEquals(List.of("broken", "logistic_win", "ridge_model_2025", "wild_margin", "wilder_margin", "xgb_v2"),
                first.stream().map(ModelDescriptor::id).toList());
            assertEquals(0, registry.loadAttempts(), "listing must not load models");
        }

        @Test
        @DisplayName("health check reports unavailable models; listing then drops them")
        void healthCheck() {
            Map<String, String> status = engine.healthCheck();
            assertEquals("loaded", status.get("ridge_model_2025"));
            assertEquals("unavailable", status.get("broken"));
            assertFalse(engine.listAvailableModels().stream().anyMatch(d -> d.id().equals("broken")));
        }

        @Test
        @DisplayName("descriptor exposes windowed historical accuracy")
        void descriptorAccuracy() {
            ModelDescriptor ridge = engine.listAvailableModels().stream()
                .filter(d -> d.id().equals("ridge_model_2025")).findFirst().orElseThrow();
            assertEquals(0.6, ridge.historicalAccuracy(), 1e-12);
            assertEquals(ELO, ridge.requiredFeatures());
        }
    }
}
