package com.smurthy.ai.agri.history;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DynamoDB-backed query history.
 *
 * Records are partitioned by primary category and sorted by time, so the latest queries of a
 * category come back from a single descending query.
 */
public class DynamoDBQueryHistoryStore implements QueryHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(DynamoDBQueryHistoryStore.class);

    private final DynamoDbTable<QueryRecordEntity> table;
    private final int ttlDays;

    public DynamoDBQueryHistoryStore(DynamoDbTable<QueryRecordEntity> table, int ttlDays) {
        this.table = table;
        this.ttlDays = ttlDays;
    }

    @Override
    public void save(QueryRecord record) {
        table.putItem(toEntity(record));
        log.debug("Stored query {} under '{}'", record.queryId(), record.primaryCategory().key());
    }

    @Override
    public List<QueryRecord> recent(Category category, int limit) {
        try {
            QueryConditional queryConditional = QueryConditional
                    .keyEqualTo(Key.builder()
                            .partitionValue(category.key())
                            .build());

            QueryEnhancedRequest queryRequest = QueryEnhancedRequest.builder()
                    .queryConditional(queryConditional)
                    .scanIndexForward(false)  // Sort descending (newest first)
                    .limit(limit)
                    .build();

            return table.query(queryRequest)
                    .items()
                    .stream()
                    .limit(limit)
                    .map(DynamoDBQueryHistoryStore::fromEntity)
                    .collect(Collectors.toList());

        } catch (Exception e) {
            log.error("Error retrieving history for category '{}'", category.key(), e);
            return Collections.emptyList();
        }
    }

    QueryRecordEntity toEntity(QueryRecord record) {
        long millis = record.timestamp().toEpochMilli();
        QueryRecordEntity entity = new QueryRecordEntity();
        entity.setCategory(record.primaryCategory().key());
        entity.setSortKey(QueryRecordEntity.sortKeyOf(millis, record.queryId()));
        entity.setQueryId(record.queryId());
        entity.setTimestamp(millis);
        entity.setQueryText(record.queryText());
        entity.setLanguage(record.language().code());
        entity.setCategories(record.categories().stream().map(Category::key).collect(Collectors.toList()));
        entity.setSuccess(record.success());
        entity.setConfidence(record.confidence());
        entity.setSources(record.sources());
        entity.setFailureCount(record.failureCount());
        entity.setLatencyMs(record.latencyMs());
        entity.setContext(record.context());
        entity.setExpirationTime(ttlDays > 0
                ? record.timestamp().plusSeconds(ttlDays * 24L * 60 * 60).getEpochSecond()
                : null);
        return entity;
    }

    static QueryRecord fromEntity(QueryRecordEntity entity) {
        Category primary = Category.fromKey(entity.getCategory()).orElse(Category.GENERAL);
        List<Category> categories = entity.getCategories() == null ? List.of(primary)
                : entity.getCategories().stream()
                        .map(key -> Category.fromKey(key).orElse(Category.GENERAL))
                        .collect(Collectors.toList());
        return new QueryRecord(
                entity.getQueryId(),
                entity.getTimestamp() != null ? Instant.ofEpochMilli(entity.getTimestamp()) : Instant.EPOCH,
                entity.getQueryText(),
                Language.fromCode(entity.getLanguage()).orElse(Language.ENGLISH),
                primary,
                categories,
                entity.getContext(),
                Boolean.TRUE.equals(entity.getSuccess()),
                entity.getConfidence() != null ? entity.getConfidence() : 0.0,
                entity.getSources(),
                entity.getFailureCount() != null ? entity.getFailureCount() : 0,
                entity.getLatencyMs() != null ? entity.getLatencyMs() : 0L);
    }
}
