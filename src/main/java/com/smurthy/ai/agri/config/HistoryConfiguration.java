package com.smurthy.ai.agri.config;

import com.smurthy.ai.agri.history.LoggingQueryHistoryStore;
import com.smurthy.ai.agri.history.QueryHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Background writer for query history, plus the log-only store used without DynamoDB.
 */
@Configuration
public class HistoryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(HistoryConfiguration.class);

    private static final int HISTORY_QUEUE_CAPACITY = 1000;

    /**
     * Single writer thread with a bounded queue; when the queue is full new records are rejected
     * and dropped by the recorder.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService historyExecutor() {
        log.info("Creating history executor (queue capacity {})", HISTORY_QUEUE_CAPACITY);
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(HISTORY_QUEUE_CAPACITY),
                runnable -> {
                    Thread thread = new Thread(runnable, "query-history");
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @Bean
    @ConditionalOnProperty(name = "advisor.history.dynamodb.enabled", havingValue = "false", matchIfMissing = true)
    public QueryHistoryStore loggingQueryHistoryStore() {
        log.info("DynamoDB history disabled, query history goes to the log");
        return new LoggingQueryHistoryStore();
    }
}
