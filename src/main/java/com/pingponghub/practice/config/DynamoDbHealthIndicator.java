package com.pingponghub.practice.config;

import com.pingponghub.practice.util.PracticeKeyFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports the PracticeTable status on the actuator health endpoint.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient) {
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public Health health() {
        try {
            TableDescription table = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(PracticeKeyFactory.TABLE_NAME).build()
            ).table();

            if (table.tableStatus() != TableStatus.ACTIVE) {
                return Health.down()
                    .withDetail("practiceTable", String.valueOf(table.tableStatus()))
                    .withDetail("reason", "PracticeTable not active")
                    .build();
            }
            return Health.up()
                .withDetail("practiceTable", "ACTIVE")
                .withDetail("gsiCount", table.globalSecondaryIndexes().size())
                .build();

        } catch (DynamoDbException e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
