package com.analyticsplatform.common.context;

import com.analyticsplatform.common.model.AnalyticsRequest;
import com.analyticsplatform.common.model.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextManagerTest {

    private static final String QUERY = "Who wins Ohio State vs Michigan?";

    // ── role profile ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("role profile")
    class ProfileTests {

        private final ContextManager manager = new ContextManager();

        @Test
        @DisplayName("advanced caller naming models → DATA_SCIENTIST with 0.75 of the budget")
        void dataScientistProfile() {
            AnalyticsRequest request = AnalyticsRequest.of("u1", QUERY, "prediction", Map.of(),
                Map.of("models", List.of("ridge_model_2025", "xgb_v2"), "skill_level", "advanced"));

            BuiltContext context = manager.buildContext(request);

            assertEquals(UserRole.DATA_SCIENTIST, context.role());
            assertEquals(0.75, context.budgetFraction());
            assertEquals(75_000, context.tokenBudget());
            assertEquals(0.75, context.profile().budgetFraction());
        }

        @Test
        @DisplayName("empty hints → ANALYST with 0.50")
        void emptyHints() {
            BuiltContext context = manager.buildContext(AnalyticsRequest.of("u1", QUERY, "general", Map.of(), Map.of()));
            assertEquals(UserRole.ANALYST, context.role());
            assertEquals(0.50, context.budgetFraction());
        }

        @Test
        @DisplayName("production caller → 0.25 and no season background")
        void production() {
            BuiltContext context = manager.buildContext(
                AnalyticsRequest.of("u1", QUERY, "prediction", Map.of(), Map.of("fast_path", true)));
            assertEquals(UserRole.PRODUCTION, context.role());
            assertEquals(0.25, context.budgetFraction());
            assertTrue(context.itemsOf(ContextTier.HISTORICAL_BACKGROUND).isEmpty());
        }

        @Test
        @DisplayName("fraction follows the role, never the request size")
        void fractionIndependentOfSize() {
            AnalyticsRequest small = AnalyticsRequest.of("u1", "q", "general", Map.of(), Map.of());
            AnalyticsRequest large = AnalyticsRequest.of("u1", "q".repeat(10_000), "general",
                Map.of("game_id", "2025_12_ohio-state_michigan"), Map.of());
            assertEquals(manager.buildContext(small).budgetFraction(), manager.buildContext(large).budgetFraction());
        }

        @Test
        @DisplayName("identical requests build identical context")
        void deterministic() {
            AnalyticsRequest request = AnalyticsRequest.of("u1", QUERY, "analysis",
                Map.of("game_id", "2025_12_ohio-state_michigan"), Map.of("history", "Michigan won 2024"));
            assertEquals(manager.buildContext(request), manager.buildContext(request));
        }
    }

    // ── assembly and truncation ────────────────────────────────────────────

    @Nested
    @DisplayName("assembly and truncation")
    class TruncationTests {

        @Test
        @DisplayName("items come in tier order: entities, role explanation, history")
        void tierOrder() {
            BuiltContext context = new ContextManager().buildContext(AnalyticsRequest.of("u1", QUERY, "analysis",
                Map.of("game_id", "2025_12_ohio-state_michigan"), Map.of("history", "Michigan won 2024")));

            assertFalse(context.truncated());
            List<ContextItem> items = context.items();
            for (int i = 1; i < items.size(); i++) {
                assertTrue(items.get(i - 1).tier().priority() <= items.get(i).tier().priority());
            }
            assertEquals("query", items.get(0).key());
            assertEquals(1, context.itemsOf(ContextTier.HISTORICAL_BACKGROUND).stream()
                .filter(i -> i.key().equals("history")).count());
        }

        @Test
        @DisplayName("tight budget drops history and role text before requested entities")
        void tightBudget_keepsEntities() {
            // analyst budget = floor(40 × 0.5) = 20 tokens; the two entity items need 17
            ContextManager manager = new ContextManager(40);
            BuiltContext context = manager.buildContext(AnalyticsRequest.of("u1", QUERY, "prediction",
                Map.of("game_id", "2025_12_ohio-state_michigan"), Map.of("history", "Michigan won 2024")));

            assertEquals(20, context.tokenBudget());
            assertTrue(context.truncated());
            assertTrue(context.tokensUsed() <= context.tokenBudget());
            assertEquals(List.of("query", "game_id"), context.items().stream().map(ContextItem::key).toList());
            assertTrue(context.dropped().stream().noneMatch(i -> i.tier() == ContextTier.REQUESTED_ENTITY));

            int lowestKeptPriority = context.items().stream().mapToInt(i -> i.tier().priority()).max().orElse(0);
            assertTrue(context.dropped().stream().allMatch(i -> i.tier().priority() >= lowestKeptPriority));
        }

        @Test
        @DisplayName("zero budget drops everything")
        void zeroBudget() {
            BuiltContext context = new ContextManager(0).buildContext(AnalyticsRequest.of("u1", QUERY, "general", Map.of(), Map.of()));
            assertTrue(context.items().isEmpty());
            assertEquals(0, context.tokensUsed());
        }

        @Test
        @DisplayName("negative base budget is rejected")
        void negativeBudget() {
            assertThrows(IllegalArgumentException.class, () -> new ContextManager(-1));
        }
    }

    @Test
    @DisplayName("token estimate is chars / 4 rounded up")
    void tokenEstimate() {
        assertEquals(0, TokenEstimator.estimate(""));
        assertEquals(1, TokenEstimator.estimate("abc"));
        assertEquals(2, TokenEstimator.estimate("abcde"));
        assertEquals(0, TokenEstimator.estimate(null));
    }
}
