package com.analyticsplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Prediction task of a model together with its known output range.
 *
 * <pre>
 *   MARGIN          → home-minus-away points in [-70, 70]
 *   WIN_PROBABILITY → home win probability in [0, 1]
 * </pre>
 */
public enum ModelTask {
    MARGIN("margin", -70.0, 70.0),
    WIN_PROBABILITY("win_probability", 0.0, 1.0);

    private final String tag;
    private final double lowerBound;
    private final double upperBound;

    ModelTask(String tag, double lowerBound, double upperBound) {
        this.tag = tag;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public double upperBound() {
        return upperBound;
    }

    /** Largest variance any set of outputs inside the range can have: {@code (range / 2)²}. */
    public double maxVariance() {
        double half = (upperBound - lowerBound) / 2.0;
        return half * half;
    }

    public boolean inRange(double value) {
        return Double.isFinite(value) && value >= lowerBound && value <= upperBound;
    }

    /** Clamps into the range; NaN maps to the midpoint. */
    public double clamp(double value) {
        if (Double.isNaN(value)) return (lowerBound + upperBound) / 2.0;
        return Math.max(lowerBound, Math.min(upperBound, value));
    }

    @JsonCreator
    public static ModelTask fromTag(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Model task must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ModelTask task : values()) {
            if (task.tag.equals(normalized) || task.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return task;
            }
        }
        throw new IllegalArgumentException("Unknown model task '" + raw + "'");
    }
}
