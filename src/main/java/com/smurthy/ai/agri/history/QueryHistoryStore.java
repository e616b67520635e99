package com.smurthy.ai.agri.history;

import com.smurthy.ai.agri.model.Category;

import java.util.List;

/**
 * Persistence for answered queries. Implementations may block; callers go through
 * {@link QueryHistoryRecorder} so requests never wait on them.
 */
public interface QueryHistoryStore {

    void save(QueryRecord record);

    /**
     * Most recent records whose primary category is {@code category}, newest first.
     */
    default List<QueryRecord> recent(Category category, int limit) {
        return List.of();
    }
}
