package com.analyticsplatform.analysis.agent;

import com.analyticsplatform.common.agent.AbstractAgent;
import com.analyticsplatform.common.agent.ActionResult;
import com.analyticsplatform.common.agent.CallerContext;
import com.analyticsplatform.common.agent.Parameters;
import com.analyticsplatform.common.permission.PermissionLevel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Learning guidance keyed by skill level. The level comes from the {@code skill_level}
 * parameter, else from the caller's role.
 */
public class LearningNavigatorAgent extends AbstractAgent<LearningAction> {

    public static final String TYPE = "learning_navigator";

    public LearningNavigatorAgent(String agentId) {
        super(agentId, TYPE, PermissionLevel.READ_EXECUTE, LearningAction.class);
    }

    @Override
    protected ActionResult perform(LearningAction action, Map<String, Object> params, CallerContext caller) {
        SkillLevel level = Parameters.string(params, "skill_level")
            .flatMap(SkillLevel::parse)
            .orElseGet(() -> SkillLevel.forRole(caller != null ? caller.role() : null));

        return switch (action) {
            case RECOMMEND_CONTENT   -> recommendContent(level);
            case EXPLAIN_CONCEPTS    -> explainConcepts(params, level);
            case GUIDE_LEARNING_PATH -> guideLearningPath(level);
        };
    }

    private ActionResult recommendContent(SkillLevel level) {
        List<LearningContent.Resource> resources = LearningContent.RESOURCES.get(level);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("skill_level", level);
        payload.put("recommendations", resources);
        payload.put("insights", List.of("Start with: " + resources.get(0).title()));
        return ActionResult.success(payload);
    }

    private ActionResult explainConcepts(Map<String, Object> params, SkillLevel level) {
        List<String> requested = Parameters.stringList(params, "concepts");
        if (requested.isEmpty()) {
            requested = Parameters.stringList(params, "topic");
        }
        if (requested.isEmpty()) {
            requested = List.copyOf(new TreeSet<>(LearningContent.CONCEPTS.keySet()));
        }

        Map<String, String> explanations = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();
        for (String concept : requested) {
            String key = concept.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
            String text = LearningContent.CONCEPTS.get(key);
            if (text != null) {
                explanations.put(key, text);
            } else {
                unknown.add(concept);
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("skill_level", level);
        payload.put("explanations", explanations);
        payload.put("unknown_concepts", unknown);
        payload.put("insights", List.of("Explained " + explanations.size() + " concept(s)"));
        return ActionResult.success(payload);
    }

    private ActionResult guideLearningPath(SkillLevel level) {
        List<String> steps = LearningContent.PATHS.get(level);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("skill_level", level);
        payload.put("steps", steps);
        payload.put("insights", List.of("Next step: " + steps.get(0)));
        return ActionResult.success(payload);
    }
}
