package com.smurthy.ai.agri.agents;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.SpecialistResult;

import java.util.Map;

/**
 * A domain specialist the dispatcher can fan a query out to.
 *
 * Implementations are expected to be thread-safe and to report their own failures through
 * {@link SpecialistResult#failure}. The dispatcher still guards against anything thrown.
 */
public interface Specialist {

    /**
     * Source label shown to callers, e.g. "Weather Agent".
     */
    String name();

    Category category();

    SpecialistProfile profile();

    /**
     * @param query    the original request
     * @param context  explicit context merged with entities inferred from the query text
     */
    SpecialistResult invoke(Query query, Map<String, Object> context);
}
