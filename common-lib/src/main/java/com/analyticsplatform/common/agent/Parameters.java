package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.exception.AnalyticsException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed reads from a loosely typed action parameter map. Malformed values raise
 * {@link AnalyticsErrorCode#INVALID_PARAMETERS}; absent values return empty.
 */
public final class Parameters {

    private Parameters() {}

    public static Optional<String> string(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        if (raw == null) return Optional.empty();
        String value = raw.toString().trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public static boolean flag(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        if (raw instanceof Boolean b) return b;
        return raw != null && "true".equalsIgnoreCase(raw.toString().trim());
    }

    /** Accepts a list, or a single comma separated string. */
    public static List<String> stringList(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        if (raw instanceof Collection<?> values) {
            for (Object v : values) {
                if (v != null && !v.toString().isBlank()) out.add(v.toString().trim());
            }
        } else {
            for (String part : raw.toString().split(",")) {
                if (!part.isBlank()) out.add(part.trim());
            }
        }
        return out;
    }

    public static Optional<List<Double>> doubleList(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        if (raw == null) return Optional.empty();
        if (!(raw instanceof Collection<?> values)) {
            throw invalid(key, "expected a list of numbers");
        }
        List<Double> out = new ArrayList<>();
        for (Object v : values) {
            out.add(toDouble(key, v));
        }
        return Optional.of(out);
    }

    /**
     * Reads a nested feature map. Null values are left out so that the model engine sees
     * them as absent.
     */
    public static Optional<Map<String, Double>> numericMap(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        if (raw == null) return Optional.empty();
        if (!(raw instanceof Map<?, ?> values)) {
            throw invalid(key, "expected an object of numeric values");
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : values.entrySet()) {
            if (e.getValue() == null) continue;
            out.put(String.valueOf(e.getKey()), toDouble(key + "." + e.getKey(), e.getValue()));
        }
        return Optional.of(out);
    }

    public static List<Map<String, Object>> objectList(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        if (raw == null) return List.of();
        if (!(raw instanceof Collection<?> values)) {
            throw invalid(key, "expected a list of objects");
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object v : values) {
            if (!(v instanceof Map<?, ?> m)) {
                throw invalid(key, "expected a list of objects");
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            m.forEach((k, value) -> entry.put(String.valueOf(k), value));
            out.add(entry);
        }
        return out;
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS,
                    "Parameter '" + key + "' is not numeric: " + s, e);
            }
        }
        throw invalid(key, "is not numeric");
    }

    private static AnalyticsException invalid(String key, String reason) {
        return new AnalyticsException(AnalyticsErrorCode.INVALID_PARAMETERS, "Parameter '" + key + "' " + reason);
    }
}
