package com.analyticsplatform.common.context;

import com.analyticsplatform.common.model.UserRole;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static, per-role explanatory text and season background used to assemble supporting
 * context. Immutable.
 */
public final class RoleGuidance {

    private RoleGuidance() {}

    private static final Map<String, String> FEATURE_DESCRIPTIONS = descriptions();

    private static final Map<UserRole, String> FOCUS = Map.of(
        UserRole.ANALYST,        "Focus: key matchup metrics, recent trends and explainable insights.",
        UserRole.DATA_SCIENTIST, "Focus: model internals, feature coverage, ensemble weights and disagreement.",
        UserRole.PRODUCTION,     "Focus: fast predictions with minimal supporting context."
    );

    private static final Map<UserRole, List<String>> KEY_FEATURES = Map.of(
        UserRole.ANALYST, List.of(
            "home_talent", "away_talent", "home_elo", "away_elo",
            "home_adjusted_epa", "away_adjusted_epa"),
        UserRole.DATA_SCIENTIST, List.of(
            "home_talent", "away_talent", "home_elo", "away_elo", "spread",
            "home_adjusted_epa", "away_adjusted_epa",
            "home_adjusted_success", "away_adjusted_success",
            "home_adjusted_explosiveness", "away_adjusted_explosiveness",
            "home_total_havoc_offense", "away_total_havoc_offense"),
        UserRole.PRODUCTION, List.of("home_elo", "away_elo", "spread")
    );

    private static final Map<UserRole, List<String>> BACKGROUND = Map.of(
        UserRole.ANALYST, List.of(
            "Season feature tables cover every FBS matchup through the most recent completed week.",
            "Elo ratings carry over between seasons with regression toward the conference mean."),
        UserRole.DATA_SCIENTIST, List.of(
            "Season feature tables cover every FBS matchup through the most recent completed week.",
            "Opponent-adjusted metrics are recomputed weekly; early-season values lean on priors.",
            "Margin models were fit on home-minus-away point differential; probability models on home wins.",
            "Elo ratings carry over between seasons with regression toward the conference mean."),
        UserRole.PRODUCTION, List.of()
    );

    public static String focus(UserRole role) {
        return FOCUS.get(role);
    }

    public static List<String> keyFeatures(UserRole role) {
        return KEY_FEATURES.get(role);
    }

    public static List<String> background(UserRole role) {
        return BACKGROUND.get(role);
    }

    public static String describe(String feature) {
        return FEATURE_DESCRIPTIONS.getOrDefault(feature, feature);
    }

    private static Map<String, String> descriptions() {
        Map<String, String> d = new LinkedHashMap<>();
        d.put("home_talent", "Composite recruiting talent of the home roster");
        d.put("away_talent", "Composite recruiting talent of the away roster");
        d.put("home_elo", "Pre-game Elo rating of the home team");
        d.put("away_elo", "Pre-game Elo rating of the away team");
        d.put("spread", "Closing betting spread from the home team's perspective");
        d.put("home_adjusted_epa", "Opponent-adjusted expected points added per play, home offense");
        d.put("away_adjusted_epa", "Opponent-adjusted expected points added per play, away offense");
        d.put("home_adjusted_success", "Opponent-adjusted success rate, home offense");
        d.put("away_adjusted_success", "Opponent-adjusted success rate, away offense");
        d.put("home_adjusted_explosiveness", "Opponent-adjusted explosiveness, home offense");
        d.put("away_adjusted_explosiveness", "Opponent-adjusted explosiveness, away offense");
        d.put("home_total_havoc_offense", "Havoc rate allowed by the home offense");
        d.put("away_total_havoc_offense", "Havoc rate allowed by the away offense");
        return Map.copyOf(d);
    }
}
