package com.analyticsplatform.analysis.agent;

import com.analyticsplatform.analysis.feature.FeatureTable;
import com.analyticsplatform.common.agent.AbstractAgent;
import com.analyticsplatform.common.agent.ActionResult;
import com.analyticsplatform.common.agent.CallerContext;
import com.analyticsplatform.common.agent.Parameters;
import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.exception.AnalyticsException;
import com.analyticsplatform.common.permission.PermissionLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Descriptive analysis over feature-table rows.
 *
 * <p>Home/away pairs are features named {@code home_<metric>} and {@code away_<metric>};
 * their differential is {@code home − away}. The number of narrative insights scales with the
 * caller's budget: {@code max(1, round(6 × budgetFraction))}.
 */
public class InsightGeneratorAgent extends AbstractAgent<InsightAction> {

    public static final String TYPE = "insight_generator";

    private static final String HOME_PREFIX = "home_";
    private static final String AWAY_PREFIX = "away_";

    private final GameFeatureResolver resolver;

    public InsightGeneratorAgent(String agentId, FeatureTable featureTable) {
        super(agentId, TYPE, PermissionLevel.READ_EXECUTE_WRITE, InsightAction.class);
        this.resolver = new GameFeatureResolver(featureTable);
    }

    @Override
    protected ActionResult perform(InsightAction action, Map<String, Object> params, CallerContext caller) {
        return switch (action) {
            case GENERATE_ANALYSIS    -> generateAnalysis(params, caller);
            case STATISTICAL_ANALYSIS -> statisticalAnalysis(params);
            case COMPARATIVE_ANALYSIS -> comparativeAnalysis(params);
        };
    }

    // ── actions ────────────────────────────────────────────────────────────

    private ActionResult generateAnalysis(Map<String, Object> params, CallerContext caller) {
        ResolvedGame game = resolver.resolve(params);
        Map<String, Double> differentials = differentials(game.features());

        List<Map.Entry<String, Double>> ranked = new ArrayList<>(differentials.entrySet());
        ranked.sort(Comparator.comparingDouble((Map.Entry<String, Double> e) ->
            relativeGap(game.features(), e.getKey())).reversed());

        int limit = insightLimit(caller);
        List<String> insights = new ArrayList<>();
        for (Map.Entry<String, Double> e : ranked.subList(0, Math.min(limit, ranked.size()))) {
            String side = e.getValue() >= 0 ? "Home" : "Away";
            insights.add(String.format(Locale.ROOT, "%s edge in %s: %.2f", side, e.getKey(), Math.abs(e.getValue())));
        }
        if (insights.isEmpty()) {
            insights.add("No home/away feature pairs available for " + game.gameId());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("game_id", game.gameId());
        payload.put("differentials", differentials);
        payload.put("insights", insights);
        return ActionResult.success(payload);
    }

    private ActionResult statisticalAnalysis(Map<String, Object> params) {
        List<ResolvedGame> games = resolver.resolveAll(params);
        Map<String, List<Double>> byFeature = new TreeMap<>();
        for (ResolvedGame game : games) {
            game.features().forEach((k, v) -> {
                if (v != null && Double.isFinite(v)) {
                    byFeature.computeIfAbsent(k, x -> new ArrayList<>()).add(v);
                }
            });
        }

        Map<String, Map<String, Double>> stats = new LinkedHashMap<>();
        byFeature.forEach((feature, values) -> stats.put(feature, summarize(values)));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("games", games.stream().map(ResolvedGame::gameId).toList());
        payload.put("statistics", stats);
        payload.put("insights", List.of("Summarized " + stats.size() + " features across " + games.size() + " game(s)"));
        return ActionResult.success(payload);
    }

    private ActionResult comparativeAnalysis(Map<String, Object> params) {
        List<ResolvedGame> games = resolver.resolveAll(params);
        if (games.size() < 2) {
            throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS,
                "comparative_analysis needs at least two games");
        }
        String metric = Parameters.string(params, "metric").orElse("elo");

        List<Map<String, Object>> ranking = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (ResolvedGame game : games) {
            Double home = game.features().get(HOME_PREFIX + metric);
            Double away = game.features().get(AWAY_PREFIX + metric);
            if (home == null || away == null) {
                missing.add(game.gameId());
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("game_id", game.gameId());
            row.put("differential", home - away);
            ranking.add(row);
        }
        ranking.sort(Comparator.comparingDouble((Map<String, Object> r) -> (Double) r.get("differential")).reversed());

        List<String> insights = new ArrayList<>();
        if (!ranking.isEmpty()) {
            Map<String, Object> top = ranking.get(0);
            insights.add(String.format(Locale.ROOT, "Largest %s edge: %s (%+.2f)",
                metric, top.get("game_id"), (Double) top.get("differential")));
        }
        if (!missing.isEmpty()) {
            insights.add("No " + metric + " data for " + String.join(", ", missing));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("metric", metric);
        payload.put("ranking", ranking);
        payload.put("missing_metric", missing);
        payload.put("insights", insights);
        return ActionResult.success(payload);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static Map<String, Double> differentials(Map<String, Double> features) {
        Map<String, Double> out = new TreeMap<>();
        for (Map.Entry<String, Double> e : features.entrySet()) {
            if (!e.getKey().startsWith(HOME_PREFIX) || e.getValue() == null) continue;
            String metric = e.getKey().substring(HOME_PREFIX.length());
            Double away = features.get(AWAY_PREFIX + metric);
            if (away != null) {
                out.put(metric, e.getValue() - away);
            }
        }
        return out;
    }

    private static double relativeGap(Map<String, Double> features, String metric) {
        double home = features.get(HOME_PREFIX + metric);
        double away = features.get(AWAY_PREFIX + metric);
        double scale = Math.max(Math.max(Math.abs(home), Math.abs(away)), 1e-9);
        return Math.abs(home - away) / scale;
    }

    static int insightLimit(CallerContext caller) {
        double fraction = caller != null ? caller.budgetFraction() : 0.5;
        return Math.max(1, (int) Math.round(6 * fraction));
    }

    private static Map<String, Double> summarize(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0.0);
        Map<String, Double> s = new LinkedHashMap<>();
        s.put("count", (double) values.size());
        s.put("mean", mean);
        s.put("std_dev", Math.sqrt(variance));
        s.put("min", values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0));
        s.put("max", values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0));
        return s;
    }
}
