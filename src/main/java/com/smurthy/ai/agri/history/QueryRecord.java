package com.smurthy.ai.agri.history;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Classification;
import com.smurthy.ai.agri.model.Language;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.SynthesizedResponse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One answered query, as kept in the history store.
 */
public record QueryRecord(
        String queryId,
        Instant timestamp,
        String queryText,
        Language language,
        Category primaryCategory,
        List<Category> categories,
        Map<String, Object> context,
        boolean success,
        double confidence,
        List<String> sources,
        int failureCount,
        long latencyMs
) {
    public QueryRecord {
        categories = categories != null ? List.copyOf(categories) : List.of();
        context = context != null ? Map.copyOf(context) : Map.of();
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    public static QueryRecord of(String queryId, Instant timestamp, Query query, Classification classification,
                                 SynthesizedResponse response, long latencyMs) {
        List<Category> categories = new ArrayList<>();
        categories.add(classification.primary());
        categories.addAll(classification.secondaries());
        return new QueryRecord(queryId, timestamp, query.text(), classification.language(),
                classification.primary(), categories, classification.entities(), response.success(),
                response.confidence(), response.sources(), response.failures().size(), latencyMs);
    }
}
