package com.smurthy.ai.agri.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The ten languages the advisor understands. English is the fallback.
 */
public enum Language {
    ENGLISH("en", "English"),
    HINDI("hi", "Hindi"),
    TAMIL("ta", "Tamil"),
    TELUGU("te", "Telugu"),
    BENGALI("bn", "Bengali"),
    MARATHI("mr", "Marathi"),
    GUJARATI("gu", "Gujarati"),
    KANNADA("kn", "Kannada"),
    MALAYALAM("ml", "Malayalam"),
    PUNJABI("pa", "Punjabi");

    private final String code;
    private final String displayName;

    Language(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<Language> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.code.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
