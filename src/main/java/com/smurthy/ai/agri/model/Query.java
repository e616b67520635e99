package com.smurthy.ai.agri.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An inbound farmer request. Immutable once built.
 *
 * @param text               raw natural-language query, never blank
 * @param context            optional loosely typed hints (location, crop_type, farmer_type, land_area,
 *                           state, season, soil_type, ...); null values are dropped
 * @param requestedLanguage  language code the caller asked for, or null to infer it
 * @param comprehensive      fan out to every applicable specialist instead of the best match
 */
public record Query(
        String text,
        Map<String, Object> context,
        String requestedLanguage,
        boolean comprehensive
) {
    public static final String LOCATION = "location";
    public static final String STATE = "state";
    public static final String CROP_TYPE = "crop_type";
    public static final String FARMER_TYPE = "farmer_type";
    public static final String LAND_AREA = "land_area";
    public static final String SEASON = "season";
    public static final String SOIL_TYPE = "soil_type";

    public Query {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Query text must not be blank");
        }
        context = copyOf(context);
        if (requestedLanguage != null && requestedLanguage.isBlank()) {
            requestedLanguage = null;
        }
    }

    public static Query of(String text) {
        return new Query(text, Map.of(), null, false);
    }

    public static Query comprehensive(String text, Map<String, Object> context) {
        return new Query(text, context, null, true);
    }

    public Optional<String> language() {
        return Optional.ofNullable(requestedLanguage);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
