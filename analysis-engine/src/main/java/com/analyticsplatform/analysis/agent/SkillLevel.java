package com.analyticsplatform.analysis.agent;

import com.analyticsplatform.common.model.UserRole;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum SkillLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SkillLevel> parse(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (SkillLevel level : values()) {
            if (level.name().equals(normalized)) return Optional.of(level);
        }
        return Optional.empty();
    }

    /** Skill level assumed when the caller does not name one. */
    public static SkillLevel forRole(UserRole role) {
        if (role == null) return INTERMEDIATE;
        return switch (role) {
            case DATA_SCIENTIST -> ADVANCED;
            case ANALYST        -> INTERMEDIATE;
            case PRODUCTION     -> BEGINNER;
        };
    }
}
