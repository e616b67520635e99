package com.smurthy.ai.agri.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of classifying a query: language, routing categories and the context the
 * specialists will see.
 *
 * @param language     detected or requested language
 * @param primary      best matching category, GENERAL when nothing matched
 * @param secondaries  further categories to consult, only populated for comprehensive queries
 * @param scores       keyword hits per specialist category
 * @param entities     inferred entities merged under the caller's explicit context
 */
public record Classification(
        Language language,
        Category primary,
        List<Category> secondaries,
        Map<Category, Integer> scores,
        Map<String, Object> entities
) {
    public Classification {
        language = language != null ? language : Language.ENGLISH;
        primary = primary != null ? primary : Category.GENERAL;
        secondaries = secondaries != null ? List.copyOf(secondaries) : List.of();
        scores = scores == null || scores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(scores));
        entities = entities == null || entities.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
    }

    /**
     * Fallback used when nothing in the text points anywhere.
     */
    public static Classification general(Language language, Map<String, Object> entities) {
        return new Classification(language, Category.GENERAL, List.of(), Map.of(), entities);
    }

    public int scoreOf(Category category) {
        return scores.getOrDefault(category, 0);
    }
}
