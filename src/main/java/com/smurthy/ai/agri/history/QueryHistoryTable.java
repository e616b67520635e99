package com.smurthy.ai.agri.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTimeToLiveRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveDescription;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveSpecification;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveStatus;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

/**
 * Makes sure the history table exists and expires records through {@link QueryRecordEntity#EXPIRATION_ATTRIBUTE}.
 */
public class QueryHistoryTable {

    private static final Logger log = LoggerFactory.getLogger(QueryHistoryTable.class);

    private final DynamoDbClient client;
    private final DynamoDbTable<QueryRecordEntity> table;
    private final int ttlDays;

    public QueryHistoryTable(DynamoDbClient client, DynamoDbTable<QueryRecordEntity> table, int ttlDays) {
        this.client = client;
        this.table = table;
        this.ttlDays = ttlDays;
    }

    /**
     * Creates the table when missing and turns on TTL when records should expire.
     *
     * @return true when the table had to be created
     */
    public boolean ensureReady() {
        String tableName = table.tableName();
        DescribeTableRequest describe = DescribeTableRequest.builder().tableName(tableName).build();
        boolean created = false;

        try {
            client.describeTable(describe);
            log.info("[QueryHistoryTable] Table '{}' found", tableName);
        } catch (ResourceNotFoundException e) {
            log.info("[QueryHistoryTable] Creating table '{}'", tableName);
            table.createTable();
            try (DynamoDbWaiter waiter = client.waiter()) {
                waiter.waitUntilTableExists(describe);
            }
            created = true;
        }

        if (ttlDays > 0 && !ttlActive(tableName)) {
            client.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                    .tableName(tableName)
                    .timeToLiveSpecification(TimeToLiveSpecification.builder()
                            .enabled(true)
                            .attributeName(QueryRecordEntity.EXPIRATION_ATTRIBUTE)
                            .build())
                    .build());
            log.info("[QueryHistoryTable] TTL enabled on '{}', records expire after {} days", tableName, ttlDays);
        }
        return created;
    }

    private boolean ttlActive(String tableName) {
        TimeToLiveDescription description = client.describeTimeToLive(DescribeTimeToLiveRequest.builder()
                        .tableName(tableName)
                        .build())
                .timeToLiveDescription();
        if (description == null) {
            return false;
        }
        TimeToLiveStatus status = description.timeToLiveStatus();
        return status == TimeToLiveStatus.ENABLED || status == TimeToLiveStatus.ENABLING;
    }
}
