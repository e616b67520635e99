package com.smurthy.ai.agri.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partial answer produced by one specialist invocation.
 *
 * The payload is opaque to the orchestration core; only {@code confidence} and {@code source}
 * are interpreted.
 */
public record SpecialistResult(
        Category category,
        String source,
        Map<String, Object> payload,
        double confidence,
        Outcome outcome,
        String failureReason,
        Duration elapsed,
        List<Recommendation> recommendations
) {
    public SpecialistResult {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(outcome, "outcome");
        if (payload != null) {
            payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static SpecialistResult success(Category category, String source, Map<String, Object> payload,
                                           double confidence, List<Recommendation> recommendations) {
        return new SpecialistResult(category, source, payload, confidence, Outcome.SUCCESS, null,
                Duration.ZERO, recommendations);
    }

    public static SpecialistResult failure(Category category, String source, String reason, Duration elapsed) {
        return new SpecialistResult(category, source, Map.of(), 0.0, Outcome.FAILURE, reason, elapsed, List.of());
    }

    public static SpecialistResult timeout(Category category, String source, Duration budget) {
        return new SpecialistResult(category, source, Map.of(), 0.0, Outcome.TIMEOUT,
                "No response within " + budget.toMillis() + "ms", budget, List.of());
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    /**
     * Re-stamps the result with the category it was dispatched for and the elapsed time measured
     * by the dispatcher.
     */
    public SpecialistResult attributedTo(Category dispatchedCategory, Duration measured) {
        return new SpecialistResult(dispatchedCategory, source, payload, confidence, outcome, failureReason,
                measured, recommendations);
    }
}
