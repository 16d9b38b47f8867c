package com.pingponghub.practice.repository.impl;

import com.pingponghub.practice.exception.RepositoryException;
import com.pingponghub.practice.exception.ResourceNotFoundException;
import com.pingponghub.practice.model.RecurrenceRule;
import com.pingponghub.practice.repository.RecurrenceRuleRepository;
import com.pingponghub.practice.util.PracticeKeyFactory;
import com.pingponghub.practice.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static com.pingponghub.practice.util.PracticeKeyFactory.TABLE_NAME;

/**
 * DynamoDB implementation of RecurrenceRuleRepository.
 */
@Repository
public class RecurrenceRuleRepositoryImpl implements RecurrenceRuleRepository {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceRuleRepositoryImpl.class);

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<RecurrenceRule> ruleSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public RecurrenceRuleRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.ruleSchema = TableSchema.fromBean(RecurrenceRule.class);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public RecurrenceRule save(RecurrenceRule rule) {
        return performanceTracker.trackQuery("saveRecurrenceRule", TABLE_NAME, () -> {
            try {
                rule.touch();

                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(ruleSchema.itemToMap(rule, true))
                    .build());

                logger.debug("Saved recurrence rule {} ({})", rule.getRuleId(), rule.getKind());
                return rule;

            } catch (DynamoDbException e) {
                logger.error("Failed to save recurrence rule {}", rule.getRuleId(), e);
                throw new RepositoryException("Failed to save recurrence rule", e);
            }
        });
    }

    @Override
    public Optional<RecurrenceRule> findById(String ruleId) {
        return performanceTracker.trackQuery("findRecurrenceRuleById", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyOf(ruleId))
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(ruleSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find recurrence rule {}", ruleId, e);
                throw new RepositoryException("Failed to retrieve recurrence rule", e);
            }
        });
    }

    @Override
    public void updateEndDate(String ruleId, LocalDate endDate) {
        performanceTracker.trackQuery("updateRecurrenceRuleEndDate", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyOf(ruleId))
                    .updateExpression("SET endDate = :endDate, updatedAt = :updatedAt")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeValues(Map.of(
                        ":endDate", AttributeValue.builder().s(endDate.toString()).build(),
                        ":updatedAt", AttributeValue.builder()
                            .n(String.valueOf(Instant.now().toEpochMilli())).build()
                    ))
                    .build());

                logger.debug("Moved end date of recurrence rule {} to {}", ruleId, endDate);
                return null;

            } catch (ConditionalCheckFailedException e) {
                throw new ResourceNotFoundException("Recurrence rule not found: " + ruleId);
            } catch (DynamoDbException e) {
                logger.error("Failed to update end date of recurrence rule {}", ruleId, e);
                throw new RepositoryException("Failed to update recurrence rule end date", e);
            }
        });
    }

    @Override
    public void deleteById(String ruleId) {
        performanceTracker.trackQuery("deleteRecurrenceRule", TABLE_NAME, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyOf(ruleId))
                    .build());

                logger.debug("Deleted recurrence rule {}", ruleId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete recurrence rule {}", ruleId, e);
                throw new RepositoryException("Failed to delete recurrence rule", e);
            }
        });
    }

    private Map<String, AttributeValue> keyOf(String ruleId) {
        return Map.of(
            "pk", AttributeValue.builder().s(PracticeKeyFactory.getRulePk(ruleId)).build(),
            "sk", AttributeValue.builder().s(PracticeKeyFactory.getMetadataSk()).build()
        );
    }
}
