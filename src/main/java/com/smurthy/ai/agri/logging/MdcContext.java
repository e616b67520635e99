package com.smurthy.ai.agri.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing advisor-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String QUERY_ID = "queryId";
    public static final String CATEGORY = "category";
    public static final String SPECIALIST = "specialist";

    private MdcContext() {}

    public static void setQuery(String queryId) {
        MDC.put(QUERY_ID, queryId);
    }

    public static void setSpecialist(String queryId, String category, String specialist) {
        MDC.put(QUERY_ID, queryId);
        MDC.put(CATEGORY, category);
        MDC.put(SPECIALIST, specialist);
    }

    /**
     * Snapshot of the caller's MDC, to be restored on a worker thread.
     */
    public static Map<String, String> capture() {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return context != null ? context : Map.of();
    }

    public static void restore(Map<String, String> context) {
        if (context.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    public static void clear() {
        MDC.remove(QUERY_ID);
        MDC.remove(CATEGORY);
        MDC.remove(SPECIALIST);
    }
}
