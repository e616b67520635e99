package com.smurthy.ai.agri.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Topic category a query is routed by.
 *
 * GENERAL is never served by a dedicated specialist; it stands for "ask everybody".
 */
public enum Category {
    WEATHER("weather"),
    CROP("crop"),
    FINANCE("finance"),
    GENERAL("general");

    private static final List<Category> SPECIALIST_CATEGORIES = List.of(WEATHER, CROP, FINANCE);

    private final String key;

    Category(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Categories that must be backed by at least one specialist, in priority order.
     * The order doubles as the tie-break order for classification.
     */
    public static List<Category> specialistCategories() {
        return SPECIALIST_CATEGORIES;
    }

    public static Optional<Category> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.key.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
