package com.analyticsplatform.analysis.agent;

import com.analyticsplatform.analysis.feature.FeatureTable;
import com.analyticsplatform.analysis.feature.GameKey;
import com.analyticsplatform.common.agent.Parameters;
import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.exception.AnalyticsException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the feature map an action should run on.
 *
 * <p>Sources, first match wins:
 * <ol>
 *   <li>{@code features}: an inline feature map (game id taken from {@code game_id} or {@code "inline"})</li>
 *   <li>{@code game_id}: a feature-table lookup</li>
 *   <li>{@code season}, {@code week}, {@code home_team}, {@code away_team}: a {@link GameKey} lookup</li>
 * </ol>
 */
public class GameFeatureResolver {

    private final FeatureTable featureTable;

    public GameFeatureResolver(FeatureTable featureTable) {
        this.featureTable = featureTable;
    }

    public ResolvedGame resolve(Map<String, Object> params) {
        Optional<Map<String, Double>> inline = Parameters.numericMap(params, "features");
        if (inline.isPresent()) {
            return new ResolvedGame(Parameters.string(params, "game_id").orElse("inline"), inline.get());
        }

        String gameId = Parameters.string(params, "game_id").orElseGet(() -> keyFrom(params));
        if (gameId == null) {
            throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS,
                "Provide features, game_id, or season/week/home_team/away_team");
        }
        return lookup(gameId);
    }

    /**
     * Resolves every entry of a {@code games} list (game ids or parameter objects); falls
     * back to a single {@link #resolve} when the list is absent.
     */
    public List<ResolvedGame> resolveAll(Map<String, Object> params) {
        Object raw = params.get("games");
        if (!(raw instanceof Collection<?> games) || games.isEmpty()) {
            return List.of(resolve(params));
        }
        List<ResolvedGame> out = new ArrayList<>();
        for (Map<String, Object> game : gameParameters(games)) {
            out.add(resolve(game));
        }
        return out;
    }

    /** Normalizes a {@code games} list into one parameter map per game. */
    public static List<Map<String, Object>> gameParameters(Collection<?> games) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object game : games) {
            if (game instanceof Map<?, ?> m) {
                Map<String, Object> entry = new LinkedHashMap<>();
                m.forEach((k, v) -> entry.put(String.valueOf(k), v));
                out.add(entry);
            } else if (game != null) {
                out.add(Map.of("game_id", game.toString()));
            }
        }
        return out;
    }

    private ResolvedGame lookup(String gameId) {
        return featureTable.lookup(gameId)
            .map(features -> new ResolvedGame(gameId, features))
            .orElseThrow(() -> new AnalyticsException(AnalyticsErrorCode.FEATURES_NOT_FOUND,
                "No feature row for game '" + gameId + "'", Map.of("gameId", gameId)));
    }

    private static String keyFrom(Map<String, Object> params) {
        Optional<String> home = Parameters.string(params, "home_team");
        Optional<String> away = Parameters.string(params, "away_team");
        Optional<String> season = Parameters.string(params, "season");
        Optional<String> week = Parameters.string(params, "week");
        if (home.isEmpty() || away.isEmpty() || season.isEmpty() || week.isEmpty()) {
            return null;
        }
        return GameKey.of(integer("season", season.get()), integer("week", week.get()), home.get(), away.get());
    }

    private static int integer(String key, String raw) {
        try {
            return (int) Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS,
                "Parameter '" + key + "' is not a number: " + raw, e);
        }
    }
}
