package com.analyticsplatform.common.context;

import com.analyticsplatform.common.model.UserRole;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic role detection from request context hints.
 *
 * <p>Rules (evaluated in priority order):
 * <ol>
 *   <li>non-empty {@code models} AND {@code skill_level == advanced} → {@link UserRole#DATA_SCIENTIST}</li>
 *   <li>{@code fast_path} or {@code production} set, or {@code role}/{@code mode} equal to
 *       {@code production}                                          → {@link UserRole#PRODUCTION}</li>
 *   <li>otherwise (including null or empty hints)                   → {@link UserRole#ANALYST}</li>
 * </ol>
 *
 * <p>No logging. No side-effects.
 */
public final class RoleDetector {

    private RoleDetector() {}

    public static UserRole detect(Map<String, Object> hints) {
        if (hints == null || hints.isEmpty()) {
            return UserRole.ANALYST;
        }

        if (hasModels(hints.get("models")) && "advanced".equals(lower(hints.get("skill_level")))) {
            return UserRole.DATA_SCIENTIST;
        }

        if (truthy(hints.get("fast_path")) || truthy(hints.get("production"))
                || "production".equals(lower(hints.get("role")))
                || "production".equals(lower(hints.get("mode")))) {
            return UserRole.PRODUCTION;
        }

        return UserRole.ANALYST;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static boolean hasModels(Object raw) {
        if (raw instanceof Collection<?> c) return !c.isEmpty();
        return raw != null && !raw.toString().isBlank();
    }

    private static boolean truthy(Object raw) {
        if (raw instanceof Boolean b) return b;
        return raw != null && "true".equals(lower(raw));
    }

    private static String lower(Object raw) {
        return raw == null ? null : raw.toString().trim().toLowerCase(Locale.ROOT);
    }
}
