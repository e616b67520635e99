package com.smurthy.ai.agri.agents;

import java.util.List;

/**
 * Self-description of a specialist, as listed by {@code GET /agents}.
 */
public record SpecialistProfile(
        String description,
        List<String> capabilities,
        List<String> keywords
) {
    public SpecialistProfile {
        capabilities = List.copyOf(capabilities);
        keywords = List.copyOf(keywords);
    }
}
