package com.smurthy.ai.agri.config;

import com.smurthy.ai.agri.history.DynamoDBQueryHistoryStore;
import com.smurthy.ai.agri.history.QueryHistoryStore;
import com.smurthy.ai.agri.history.QueryHistoryTable;
import com.smurthy.ai.agri.history.QueryRecordEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * DynamoDB-backed query history, active with {@code advisor.history.dynamodb.enabled=true}.
 * The table is created (with TTL) once the application is ready.
 */
@Configuration
@ConditionalOnProperty(name = "advisor.history.dynamodb.enabled", havingValue = "true")
public class DynamoDBConfig {

    private static final Logger log = LoggerFactory.getLogger(DynamoDBConfig.class);

    @Bean(destroyMethod = "close")
    public DynamoDbClient dynamoDbClient(HistoryStoreConfig config) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder().region(Region.of(config.region()));
        if (config.usesLocalEndpoint()) {
            // DynamoDB Local accepts any credentials
            builder.endpointOverride(URI.create(config.endpoint()))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("local", "local")));
            log.info("History store on DynamoDB Local at {}", config.endpoint());
        } else {
            log.info("History store on AWS DynamoDB in {}", config.region());
        }
        return builder.build();
    }

    @Bean
    public DynamoDbTable<QueryRecordEntity> queryRecordTable(DynamoDbClient dynamoDbClient, HistoryStoreConfig config) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build()
                .table(config.tableName(), TableSchema.fromBean(QueryRecordEntity.class));
    }

    @Bean
    public QueryHistoryStore dynamoDBQueryHistoryStore(DynamoDbTable<QueryRecordEntity> queryRecordTable,
                                                       HistoryStoreConfig config) {
        log.info("Query history goes to table '{}' (ttl {} days)", config.tableName(), config.ttlDays());
        return new DynamoDBQueryHistoryStore(queryRecordTable, config.ttlDays());
    }

    @Bean
    public QueryHistoryTable queryHistoryTable(DynamoDbClient dynamoDbClient,
                                               DynamoDbTable<QueryRecordEntity> queryRecordTable,
                                               HistoryStoreConfig config) {
        return new QueryHistoryTable(dynamoDbClient, queryRecordTable, config.ttlDays());
    }

    @Bean
    public ApplicationListener<ApplicationReadyEvent> queryHistoryTableInitializer(QueryHistoryTable queryHistoryTable) {
        return event -> queryHistoryTable.ensureReady();
    }
}
