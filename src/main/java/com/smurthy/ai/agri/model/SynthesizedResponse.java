package com.smurthy.ai.agri.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final merged answer for one query.
 *
 * @param success          at least one specialist succeeded
 * @param data             the single successful payload, or payloads keyed by category
 * @param confidence       unweighted mean of successful confidences, 0 when none succeeded
 * @param sources          source labels of the successful specialists, in dispatch order
 * @param failures         every specialist that failed or timed out
 * @param recommendations  ranked recommendations grouped by horizon
 */
public record SynthesizedResponse(
        boolean success,
        Map<String, Object> data,
        double confidence,
        List<String> sources,
        List<PartialFailure> failures,
        Map<Horizon, List<Recommendation>> recommendations
) {
    public SynthesizedResponse {
        data = data == null || data.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        sources = sources != null ? List.copyOf(sources) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        recommendations = recommendations == null || recommendations.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(recommendations));
    }

    public static SynthesizedResponse totalFailure(List<PartialFailure> failures) {
        return new SynthesizedResponse(false, Map.of(), 0.0, List.of(), failures, Map.of());
    }

    /**
     * Source labels joined for display, e.g. "Weather Agent, Crop Agent".
     */
    public String source() {
        return String.join(", ", sources);
    }

    public boolean isPartial() {
        return success && !failures.isEmpty();
    }
}
