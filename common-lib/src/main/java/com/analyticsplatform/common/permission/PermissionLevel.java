package com.analyticsplatform.common.permission;

import java.util.Locale;
import java.util.Optional;

/**
 * Ranked permission levels. A caller granted level {@code L} may invoke any capability
 * whose required level is at or below {@code L}.
 *
 * <pre>
 *   READ_ONLY (1) &lt; READ_EXECUTE (2) &lt; READ_EXECUTE_WRITE (3) &lt; ADMIN (4)
 * </pre>
 */
public enum PermissionLevel {
    READ_ONLY(1),
    READ_EXECUTE(2),
    READ_EXECUTE_WRITE(3),
    ADMIN(4);

    private final int rank;

    PermissionLevel(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /** True when this level is high enough to invoke something that requires {@code required}. */
    public boolean permits(PermissionLevel required) {
        return required != null && this.rank >= required.rank;
    }

    /** Returns the lower of the two levels. */
    public PermissionLevel min(PermissionLevel other) {
        if (other == null) return this;
        return this.rank <= other.rank ? this : other;
    }

    /**
     * Parses a level name ({@code "read_execute"}, {@code "READ-EXECUTE"}, ...).
     * Returns empty for null, blank or unknown input.
     */
    public static Optional<PermissionLevel> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (PermissionLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
