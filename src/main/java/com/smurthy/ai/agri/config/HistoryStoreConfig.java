package com.smurthy.ai.agri.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the DynamoDB query history.
 *
 * @param enabled    use DynamoDB instead of the log-only store
 * @param endpoint   endpoint override (DynamoDB Local); blank means AWS with the default credentials
 * @param region     AWS region
 * @param tableName  history table
 * @param ttlDays    days before a record expires, 0 keeps records forever
 */
@ConfigurationProperties(prefix = "advisor.history.dynamodb")
public record HistoryStoreConfig(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("") String endpoint,
        @DefaultValue("ap-south-1") String region,
        @DefaultValue("query_history") String tableName,
        @DefaultValue("30") int ttlDays
) {
    public HistoryStoreConfig {
        if (ttlDays < 0) {
            throw new IllegalArgumentException("advisor.history.dynamodb.ttl-days must not be negative");
        }
    }

    public boolean usesLocalEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }
}
