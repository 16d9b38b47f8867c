package com.pingponghub.practice.config;

import com.pingponghub.practice.model.PracticeSession;
import com.pingponghub.practice.util.PracticeKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the PracticeTable and its two GSIs on startup when missing.
 * Meant for DynamoDB Local; disable with {@code dynamodb.table.init.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Autowired
    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        // PracticeSession carries every key attribute of the table, rules included
        DynamoDbTable<PracticeSession> table = dynamoDbEnhancedClient.table(
            PracticeKeyFactory.TABLE_NAME, TableSchema.fromBean(PracticeSession.class));

        try {
            table.describeTable();
            logger.info("Table {} already exists", PracticeKeyFactory.TABLE_NAME);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", PracticeKeyFactory.TABLE_NAME);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(
                    createGSI(PracticeKeyFactory.ORGANIZER_TEAM_INDEX),
                    createGSI(PracticeKeyFactory.RECURRENCE_RULE_INDEX)
                )
                .build());
            logger.info("Table {} created with GSIs {} and {}", PracticeKeyFactory.TABLE_NAME,
                PracticeKeyFactory.ORGANIZER_TEAM_INDEX, PracticeKeyFactory.RECURRENCE_RULE_INDEX);
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
