package com.analyticsplatform.analysis.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Static learning catalog keyed by {@link SkillLevel}. */
final class LearningContent {

    record Resource(
        @JsonProperty("title") String title,
        @JsonProperty("kind") String kind,
        @JsonProperty("minutes") int minutes
    ) {}

    private LearningContent() {}

    static final Map<SkillLevel, List<Resource>> RESOURCES = Map.of(
        SkillLevel.BEGINNER, List.of(
            new Resource("Reading a matchup card", "guide", 10),
            new Resource("What Elo ratings measure", "article", 8),
            new Resource("Spreads and win probability", "article", 12)),
        SkillLevel.INTERMEDIATE, List.of(
            new Resource("Expected points added, play by play", "notebook", 25),
            new Resource("Opponent adjustment explained", "article", 15),
            new Resource("Comparing teams across conferences", "notebook", 30)),
        SkillLevel.ADVANCED, List.of(
            new Resource("Feature engineering for margin models", "notebook", 45),
            new Resource("Calibrating win-probability models", "notebook", 40),
            new Resource("Ensemble weighting and disagreement", "article", 20))
    );

    static final Map<SkillLevel, List<String>> PATHS = Map.of(
        SkillLevel.BEGINNER, List.of(
            "Learn the core team ratings: talent and Elo",
            "Read a single-game prediction and its confidence",
            "Compare a prediction with the betting spread"),
        SkillLevel.INTERMEDIATE, List.of(
            "Study opponent-adjusted efficiency: EPA and success rate",
            "Use statistical summaries across a slate of games",
            "Compare several models on the same game",
            "Rank games by a chosen metric gap"),
        SkillLevel.ADVANCED, List.of(
            "Inspect each model's required features and accuracy history",
            "Run ensembles with explicit weights",
            "Measure model disagreement and calibration",
            "Batch-predict a week and review failures")
    );

    static final Map<String, String> CONCEPTS = concepts();

    private static Map<String, String> concepts() {
        Map<String, String> c = new LinkedHashMap<>();
        c.put("elo", "A rating that rises with wins and falls with losses, weighted by opponent strength.");
        c.put("talent", "Composite recruiting rating of a roster.");
        c.put("epa", "Expected points added: the change in expected score produced by a play.");
        c.put("success_rate", "Share of plays that gain enough yards to stay on schedule.");
        c.put("explosiveness", "Average EPA of successful plays; how big the big plays are.");
        c.put("havoc", "Share of plays with a tackle for loss, forced fumble, interception or pass breakup.");
        c.put("spread", "Betting line for the home team; negative means the home team is favored.");
        c.put("margin", "Predicted home points minus away points.");
        c.put("win_probability", "Predicted chance that the home team wins.");
        c.put("ensemble", "Weighted combination of several models' predictions.");
        return Map.copyOf(c);
    }
}
