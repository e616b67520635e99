package com.smurthy.ai.agri.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Horizon;
import com.smurthy.ai.agri.model.PartialFailure;
import com.smurthy.ai.agri.model.Recommendation;
import com.smurthy.ai.agri.model.SynthesizedResponse;
import com.smurthy.ai.agri.orchestration.AdvisoryResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Response DTO for advisory queries. {@code failures} is left out when every specialist answered.
 */
public record QueryResponse(
        String queryId,
        boolean success,
        Map<String, Object> data,
        double confidence,
        String source,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<FailureView> failures,
        Map<String, List<RecommendationView>> recommendations,
        String language,
        List<String> categories,
        String timestamp
) {
    public record FailureView(String category, String source, String outcome, String reason) {}

    public record RecommendationView(String category, String priority, String text) {}

    public static QueryResponse from(AdvisoryResult result) {
        SynthesizedResponse response = result.response();

        List<FailureView> failures = new ArrayList<>();
        for (PartialFailure failure : response.failures()) {
            failures.add(new FailureView(failure.category().key(), failure.source(),
                    failure.outcome().name().toLowerCase(Locale.ROOT), failure.reason()));
        }

        Map<String, List<RecommendationView>> recommendations = new LinkedHashMap<>();
        for (Map.Entry<Horizon, List<Recommendation>> entry : response.recommendations().entrySet()) {
            List<RecommendationView> views = new ArrayList<>();
            for (Recommendation recommendation : entry.getValue()) {
                views.add(new RecommendationView(recommendation.category().key(),
                        recommendation.priority().name().toLowerCase(Locale.ROOT), recommendation.text()));
            }
            recommendations.put(entry.getKey().name().toLowerCase(Locale.ROOT), views);
        }

        List<String> categories = new ArrayList<>();
        categories.add(result.classification().primary().key());
        result.classification().secondaries().stream().map(Category::key).forEach(categories::add);

        return new QueryResponse(
                result.queryId(),
                response.success(),
                response.data(),
                response.confidence(),
                response.source(),
                failures,
                recommendations,
                result.classification().language().code(),
                categories,
                result.timestamp().toString());
    }
}
