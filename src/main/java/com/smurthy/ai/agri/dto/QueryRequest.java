package com.smurthy.ai.agri.dto;

import com.smurthy.ai.agri.model.Query;

import java.util.Map;

/**
 * Request body of {@code POST /query}.
 */
public record QueryRequest(
        String query,
        Map<String, Object> context,
        Boolean comprehensive,
        String language
) {
    public Query toQuery() {
        return new Query(query, context, language, Boolean.TRUE.equals(comprehensive));
    }
}
