package com.smurthy.ai.agri.model;

/**
 * A specialist that did not contribute to the response, surfaced to the caller.
 */
public record PartialFailure(
        Category category,
        String source,
        Outcome outcome,
        String reason
) {
    public static PartialFailure from(SpecialistResult result) {
        return new PartialFailure(result.category(), result.source(), result.outcome(), result.failureReason());
    }
}
