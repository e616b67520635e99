package com.smurthy.ai.agri.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands history records to the store off the request thread. Store failures are logged and
 * dropped; they never reach the caller.
 */
@Component
public class QueryHistoryRecorder {

    private static final Logger log = LoggerFactory.getLogger(QueryHistoryRecorder.class);

    private final QueryHistoryStore store;
    private final Executor executor;

    public QueryHistoryRecorder(QueryHistoryStore store, @Qualifier("historyExecutor") Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    public CompletableFuture<Void> offer(QueryRecord record) {
        try {
            return CompletableFuture.runAsync(() -> store.save(record), executor)
                    .exceptionally(e -> {
                        log.warn("[QueryHistoryRecorder] Could not store query {}: {}", record.queryId(),
                                e.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("[QueryHistoryRecorder] History queue full, dropping query {}", record.queryId());
            return CompletableFuture.completedFuture(null);
        }
    }
}
