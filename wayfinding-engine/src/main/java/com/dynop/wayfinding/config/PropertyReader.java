package com.dynop.wayfinding.config;

import com.dynop.wayfinding.AnalysisException;
import com.graphhopper.util.PMap;

import java.util.Map;

/**
 * Typed, validating access to flat dotted-key settings held in a {@link PMap}.
 *
 * <p>Missing keys fall back to the supplied default. Present keys of the wrong type or outside the
 * allowed range raise {@link AnalysisException} with {@code INVALID_CONFIGURATION} naming the key.
 */
final class PropertyReader {

    private final Map<String, Object> values;

    PropertyReader(PMap properties) {
        this.values = properties.toMap();
    }

    double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, "expected a number, was '" + value + "'");
        }
    }

    int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, "expected an integer, was '" + value + "'");
        }
    }

    long getLong(String key, long defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, "expected an integer, was '" + value + "'");
        }
    }

    boolean getBool(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) {
            return true;
        }
        if (text.equalsIgnoreCase("false")) {
            return false;
        }
        throw invalid(key, "expected true or false, was '" + value + "'");
    }

    double positive(String key, double defaultValue) {
        double value = getDouble(key, defaultValue);
        if (!(value > 0) || Double.isInfinite(value)) {
            throw invalid(key, "must be positive and finite, was " + value);
        }
        return value;
    }

    double nonNegative(String key, double defaultValue) {
        double value = getDouble(key, defaultValue);
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw invalid(key, "must be non-negative and finite, was " + value);
        }
        return value;
    }

    double percentile(String key, double defaultValue) {
        double value = getDouble(key, defaultValue);
        if (!(value >= 0 && value <= 100)) {
            throw invalid(key, "must be a percentile in [0, 100], was " + value);
        }
        return value;
    }

    double probability(String key, double defaultValue) {
        double value = getDouble(key, defaultValue);
        if (!(value >= 0 && value <= 1)) {
            throw invalid(key, "must be in [0, 1], was " + value);
        }
        return value;
    }

    int positiveInt(String key, int defaultValue) {
        int value = getInt(key, defaultValue);
        if (value <= 0) {
            throw invalid(key, "must be a positive integer, was " + value);
        }
        return value;
    }

    static AnalysisException invalid(String key, String detail) {
        return new AnalysisException(AnalysisException.INVALID_CONFIGURATION, key, detail);
    }
}
