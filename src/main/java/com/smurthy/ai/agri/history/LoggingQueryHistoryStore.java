package com.smurthy.ai.agri.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback store used when no database is configured: history goes to the log only.
 */
public class LoggingQueryHistoryStore implements QueryHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(LoggingQueryHistoryStore.class);

    @Override
    public void save(QueryRecord record) {
        log.info("[QueryHistory] {} {} lang={} success={} confidence={} sources={} failures={} {}ms",
                record.queryId(), record.primaryCategory(), record.language().code(), record.success(),
                String.format("%.2f", record.confidence()), record.sources(), record.failureCount(),
                record.latencyMs());
    }
}
