package com.smurthy.ai.agri.model;

import java.util.Objects;

/**
 * A single actionable piece of advice emitted by a specialist.
 */
public record Recommendation(
        Category category,
        Horizon horizon,
        Priority priority,
        String text
) {
    public Recommendation {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(horizon, "horizon");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(text, "text");
    }

    public static Recommendation of(Category category, Horizon horizon, Priority priority, String text) {
        return new Recommendation(category, horizon, priority, text);
    }
}
