package com.example.toolgateway.backend;

import java.util.Map;

/**
 * Typed lookups over a connection's parsed JSON config or credential map.
 * JSON numbers and booleans may arrive as strings from older clients.
 */
public final class ConfigValues {

    private ConfigValues() {
    }

    public static String getString(Map<String, Object> values, String key, String defaultValue) {
        Object value = values != null ? values.get(key) : null;
        if (value == null) {
            return defaultValue;
        }
        String text = value.toString();
        return text.isBlank() ? defaultValue : text;
    }

    public static int getInt(Map<String, Object> values, String key, int defaultValue) {
        Object value = values != null ? values.get(key) : null;
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Config value '" + key + "' is not a number: " + text, e);
            }
        }
        return defaultValue;
    }

    public static boolean getBoolean(Map<String, Object> values, String key, boolean defaultValue) {
        Object value = values != null ? values.get(key) : null;
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Boolean.parseBoolean(text.trim());
        }
        return defaultValue;
    }
}
