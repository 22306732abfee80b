package com.analyticsplatform.common.context;

import com.analyticsplatform.common.model.AnalyticsRequest;
import com.analyticsplatform.common.model.UserRole;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Builds the role profile and token-budgeted supporting context for a request.
 *
 * <h3>Assembly</h3>
 * Items are gathered in priority order:
 * <ol>
 *   <li>{@link ContextTier#REQUESTED_ENTITY}: the query text and any entity keys found in
 *       parameters or hints ({@code game_id}, {@code teams}, {@code models}, ...)</li>
 *   <li>{@link ContextTier#ROLE_EXPLANATION}: the role's focus line and descriptions of its
 *       key features</li>
 *   <li>{@link ContextTier#HISTORICAL_BACKGROUND}: the {@code history} hint, then the
 *       role's season notes</li>
 * </ol>
 *
 * <h3>Truncation</h3>
 * <pre>
 *   tokenBudget = floor(baseTokenBudget × role.budgetFraction)
 *   while tokensUsed &gt; tokenBudget: drop the last item (lowest priority first)
 * </pre>
 *
 * <p>{@link #buildContext} depends only on the request and the constructor arguments.
 */
public class ContextManager {

    public static final int DEFAULT_BASE_TOKEN_BUDGET = 100_000;

    private static final List<String> ENTITY_KEYS = List.of(
        "game_id", "games", "home_team", "away_team", "teams", "team",
        "models", "model_id", "concepts", "topic"
    );

    private final int baseTokenBudget;

    public ContextManager() {
        this(DEFAULT_BASE_TOKEN_BUDGET);
    }

    public ContextManager(int baseTokenBudget) {
        if (baseTokenBudget < 0) {
            throw new IllegalArgumentException("baseTokenBudget must be >= 0, got " + baseTokenBudget);
        }
        this.baseTokenBudget = baseTokenBudget;
    }

    public BuiltContext buildContext(AnalyticsRequest request) {
        Map<String, Object> hints = request.contextHints();
        UserRole role = RoleDetector.detect(hints);
        double fraction = role.budgetFraction();
        int tokenBudget = (int) Math.floor(baseTokenBudget * fraction);

        List<ContextItem> items = new ArrayList<>();
        items.addAll(requestedEntities(request));
        items.addAll(roleExplanation(role));
        items.addAll(historicalBackground(role, hints));

        // ── truncate lowest priority first ─────────────────────────────────
        int tokensUsed = items.stream().mapToInt(ContextItem::estimatedTokens).sum();
        List<ContextItem> dropped = new ArrayList<>();
        while (tokensUsed > tokenBudget && !items.isEmpty()) {
            ContextItem last = items.remove(items.size() - 1);
            tokensUsed -= last.estimatedTokens();
            dropped.add(last);
        }

        return new BuiltContext(role, fraction, tokenBudget, tokensUsed, items, dropped);
    }

    public int baseTokenBudget() {
        return baseTokenBudget;
    }

    // ── tiers ──────────────────────────────────────────────────────────────

    private static List<ContextItem> requestedEntities(AnalyticsRequest request) {
        List<ContextItem> out = new ArrayList<>();
        if (request.query() != null && !request.query().isBlank()) {
            out.add(ContextItem.of(ContextTier.REQUESTED_ENTITY, "query", request.query().trim()));
        }
        for (String key : ENTITY_KEYS) {
            Object value = request.parameters().get(key);
            if (value == null) {
                value = request.contextHints().get(key);
            }
            String rendered = render(value);
            if (rendered != null) {
                out.add(ContextItem.of(ContextTier.REQUESTED_ENTITY, key, key + ": " + rendered));
            }
        }
        return out;
    }

    private static List<ContextItem> roleExplanation(UserRole role) {
        List<ContextItem> out = new ArrayList<>();
        out.add(ContextItem.of(ContextTier.ROLE_EXPLANATION, "focus", RoleGuidance.focus(role)));
        for (String feature : RoleGuidance.keyFeatures(role)) {
            out.add(ContextItem.of(ContextTier.ROLE_EXPLANATION, feature,
                feature + ": " + RoleGuidance.describe(feature)));
        }
        return out;
    }

    private static List<ContextItem> historicalBackground(UserRole role, Map<String, Object> hints) {
        List<ContextItem> out = new ArrayList<>();
        Object history = hints.get("history");
        if (history instanceof Collection<?> entries) {
            int i = 0;
            for (Object entry : entries) {
                if (entry != null && !entry.toString().isBlank()) {
                    out.add(ContextItem.of(ContextTier.HISTORICAL_BACKGROUND, "history[" + i++ + "]", entry.toString()));
                }
            }
        } else if (history != null && !history.toString().isBlank()) {
            out.add(ContextItem.of(ContextTier.HISTORICAL_BACKGROUND, "history", history.toString()));
        }
        List<String> notes = RoleGuidance.background(role);
        for (int i = 0; i < notes.size(); i++) {
            out.add(ContextItem.of(ContextTier.HISTORICAL_BACKGROUND, "season_note[" + i + "]", notes.get(i)));
        }
        return out;
    }

    private static String render(Object value) {
        if (value == null) return null;
        if (value instanceof Collection<?> c) {
            if (c.isEmpty()) return null;
            List<String> parts = new ArrayList<>();
            for (Object o : c) {
                if (o != null) parts.add(o.toString());
            }
            return parts.isEmpty() ? null : String.join(", ", parts);
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
