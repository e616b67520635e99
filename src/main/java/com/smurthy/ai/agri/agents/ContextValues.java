package com.smurthy.ai.agri.agents;

import java.util.Locale;
import java.util.Map;

/**
 * Lenient readers for the loosely typed query context.
 */
final class ContextValues {

    private ContextValues() {}

    static String text(Map<String, Object> context, String key, String defaultValue) {
        Object value = context.get(key);
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        return value.toString().trim();
    }

    static String lowerText(Map<String, Object> context, String key, String defaultValue) {
        return text(context, key, defaultValue).toLowerCase(Locale.ROOT);
    }

    /**
     * "kharif" -> "Kharif", "black" -> "Black"
     */
    static String titleText(Map<String, Object> context, String key, String defaultValue) {
        String value = text(context, key, defaultValue);
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
    }

    static double number(Map<String, Object> context, String key, double defaultValue) {
        Object value = context.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
