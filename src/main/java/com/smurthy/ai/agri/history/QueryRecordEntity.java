package com.smurthy.ai.agri.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * DynamoDB entity for answered queries.
 *
 * Table Design:
 * - Partition Key: category (primary category of the query, e.g. "weather")
 * - Sort Key: sortKey = zero-padded epoch millis + "#" + queryId (newest last, unique per query)
 * - TTL: expirationTime (auto-delete old history)
 *
 * Example DynamoDB Item:
 * {
 *   "category": "weather",
 *   "sortKey": "1760659200000#3f2a...",
 *   "queryId": "3f2a...",
 *   "queryText": "Will it rain in Pune this week?",
 *   "language": "en",
 *   "categories": ["weather"],
 *   "success": true,
 *   "confidence": 0.7,
 *   "sources": ["Weather Agent"],
 *   "failureCount": 0,
 *   "contextJson": "{\"location\":\"Pune\"}",
 *   "expirationTime": 1763251200
 * }
 */
@DynamoDbBean
public class QueryRecordEntity {

    public static final String EXPIRATION_ATTRIBUTE = "expirationTime";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private String category;
    private String sortKey;
    private String queryId;
    private Long timestamp;
    private String queryText;
    private String language;
    private List<String> categories;
    private Boolean success;
    private Double confidence;
    private List<String> sources;
    private Integer failureCount;
    private Long latencyMs;
    private String contextJson;  // Serialized JSON string for DynamoDB
    private Long expirationTime;  // TTL in epoch seconds

    // Default constructor (required by DynamoDB Enhanced Client)
    public QueryRecordEntity() {
    }

    public static String sortKeyOf(long epochMillis, String queryId) {
        return String.format("%013d#%s", epochMillis, queryId);
    }

    @DynamoDbPartitionKey
    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    @DynamoDbSortKey
    public String getSortKey() {
        return sortKey;
    }

    public void setSortKey(String sortKey) {
        this.sortKey = sortKey;
    }

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public Boolean getSuccess() {
        return success;
    }

    public void setSuccess(Boolean success) {
        this.success = success;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public Integer getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(Integer failureCount) {
        this.failureCount = failureCount;
    }

    public Long getLatencyMs() {
        return latencyMs;
    }

    public void setLatencyMs(Long latencyMs) {
        this.latencyMs = latencyMs;
    }

    // DynamoDB persisted field (JSON string)
    public String getContextJson() {
        return contextJson;
    }

    public void setContextJson(String contextJson) {
        this.contextJson = contextJson;
    }

    // Application-facing methods (not persisted to DynamoDB)
    @DynamoDbIgnore
    public Map<String, Object> getContext() {
        if (contextJson == null || contextJson.isEmpty()) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(contextJson, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            // Return empty map if deserialization fails
            return new HashMap<>();
        }
    }

    public void setContext(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            this.contextJson = "{}";
            return;
        }
        try {
            this.contextJson = objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            // Store empty JSON object if serialization fails
            this.contextJson = "{}";
        }
    }

    public Long getExpirationTime() {
        return expirationTime;
    }

    public void setExpirationTime(Long expirationTime) {
        this.expirationTime = expirationTime;
    }

    @Override
    public String toString() {
        return "QueryRecordEntity{" +
                "category='" + category + '\'' +
                ", sortKey='" + sortKey + '\'' +
                ", queryText='" + (queryText != null && queryText.length() > 50 ? queryText.substring(0, 50) + "..." : queryText) + '\'' +
                ", success=" + success +
                ", confidence=" + confidence +
                ", expirationTime=" + expirationTime +
                '}';
    }
}
