package com.analyticsplatform.analysis.feature;

import java.util.Locale;

/**
 * Deterministic game identifier: {@code <season>_<week>_<home>_<away>}, team names lower-cased
 * with runs of whitespace replaced by {@code -}.
 *
 * <pre>
 *   GameKey.of(2025, 12, "Ohio State", "Michigan") → "2025_12_ohio-state_michigan"
 * </pre>
 */
public final class GameKey {

    private GameKey() {}

    public static String of(int season, int week, String homeTeam, String awayTeam) {
        return season + "_" + week + "_" + slug(homeTeam) + "_" + slug(awayTeam);
    }

    static String slug(String team) {
        if (team == null || team.isBlank()) {
            throw new IllegalArgumentException("Team name must not be blank");
        }
        return team.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }
}
