package com.experiment.framework.core;

import java.util.Map;

/**
 * Typed reads from loosely typed assignment context / metadata maps (values usually come from JSON).
 */
public final class ContextAttributes {

    private ContextAttributes() {
    }

    public static double getDouble(Map<String, ?> attributes, String key, double defaultValue) {
        if (attributes == null) {
            return defaultValue;
        }
        Object value = attributes.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static String getString(Map<String, ?> attributes, String key, String defaultValue) {
        if (attributes == null) {
            return defaultValue;
        }
        Object value = attributes.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
