package com.pingponghub.practice.repository.impl;

import com.pingponghub.practice.exception.RepositoryException;
import com.pingponghub.practice.model.PracticeSession;
import com.pingponghub.practice.repository.PracticeSessionRepository;
import com.pingponghub.practice.util.PracticeKeyFactory;
import com.pingponghub.practice.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

import static com.pingponghub.practice.util.PracticeKeyFactory.TABLE_NAME;

/**
 * DynamoDB implementation of PracticeSessionRepository.
 * Uses the single-table design pattern with the PracticeTable.
 */
@Repository
public class PracticeSessionRepositoryImpl implements PracticeSessionRepository {

    private static final Logger logger = LoggerFactory.getLogger(PracticeSessionRepositoryImpl.class);

    static final int BATCH_SIZE = 25;
    private static final int MAX_BATCH_ATTEMPTS = 3;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<PracticeSession> sessionSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public PracticeSessionRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.sessionSchema = TableSchema.fromBean(PracticeSession.class);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public PracticeSession save(PracticeSession session) {
        return performanceTracker.trackQuery("savePracticeSession", TABLE_NAME, () -> {
            try {
                session.touch();
                session.refreshIndexKeys();

                PutItemRequest request = PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(sessionSchema.itemToMap(session, true))
                    .build();

                dynamoDbClient.putItem(request);

                logger.debug("Saved practice session {}", session.getSessionId());
                return session;

            } catch (DynamoDbException e) {
                logger.error("Failed to save practice session {}", session.getSessionId(), e);
                throw new RepositoryException("Failed to save practice session", e);
            }
        });
    }

    @Override
    public void saveAll(List<PracticeSession> sessions) {
        if (sessions.isEmpty()) {
            return;
        }
        performanceTracker.trackQuery("batchSavePracticeSessions", TABLE_NAME, () -> {
            List<WriteRequest> writes = sessions.stream()
                .map(session -> {
                    session.touch();
                    session.refreshIndexKeys();
                    return WriteRequest.builder()
                        .putRequest(PutRequest.builder().item(sessionSchema.itemToMap(session, true)).build())
                        .build();
                })
                .collect(Collectors.toList());

            writeInChunks(writes, "save");
            logger.debug("Saved {} practice sessions", sessions.size());
            return null;
        });
    }

    @Override
    public Optional<PracticeSession> findById(String sessionId) {
        return performanceTracker.trackQuery("findPracticeSessionById", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyOf(sessionId))
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(sessionSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find practice session {}", sessionId, e);
                throw new RepositoryException("Failed to retrieve practice session", e);
            }
        });
    }

    @Override
    public List<PracticeSession> findByOrganizerAndTeamOnDates(String organizerId, String teamName,
                                                               Collection<LocalDate> dates) {
        if (dates.isEmpty()) {
            return List.of();
        }
        Set<LocalDate> wanted = new HashSet<>(dates);
        LocalDate from = Collections.min(wanted);
        LocalDate to = Collections.max(wanted);

        return findByOrganizerAndTeamBetween(organizerId, teamName, from, to).stream()
            .filter(session -> wanted.contains(session.getEventDate()))
            .collect(Collectors.toList());
    }

    @Override
    public List<PracticeSession> findByOrganizerAndTeamBetween(String organizerId, String teamName,
                                                               LocalDate from, LocalDate to) {
        return performanceTracker.trackQuery("findPracticeSessionsByOrganizerTeam",
                PracticeKeyFactory.ORGANIZER_TEAM_INDEX, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(PracticeKeyFactory.ORGANIZER_TEAM_INDEX)
                    .keyConditionExpression("gsi1pk = :organizerTeam AND gsi1sk BETWEEN :from AND :to")
                    .filterExpression("itemType = :itemType")
                    .expressionAttributeValues(Map.of(
                        ":organizerTeam", AttributeValue.builder()
                            .s(PracticeKeyFactory.getOrganizerTeamKey(organizerId, teamName)).build(),
                        ":from", AttributeValue.builder().s(from.toString()).build(),
                        ":to", AttributeValue.builder().s(PracticeKeyFactory.getEndOfDaySlotSk(to)).build(),
                        ":itemType", AttributeValue.builder().s(PracticeSession.ITEM_TYPE).build()
                    ))
                    .scanIndexForward(true)
                    .build();

                return queryAll(request);

            } catch (DynamoDbException e) {
                logger.error("Failed to query practice sessions for organizer {} team {}", organizerId, teamName, e);
                throw new RepositoryException("Failed to query practice sessions by organizer and team", e);
            }
        });
    }

    @Override
    public List<PracticeSession> findByRecurrenceRuleId(String ruleId) {
        return performanceTracker.trackQuery("findPracticeSessionsByRule",
                PracticeKeyFactory.RECURRENCE_RULE_INDEX, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(PracticeKeyFactory.RECURRENCE_RULE_INDEX)
                    .keyConditionExpression("gsi2pk = :rule")
                    .expressionAttributeValues(Map.of(
                        ":rule", AttributeValue.builder().s(PracticeKeyFactory.getRulePk(ruleId)).build()
                    ))
                    .scanIndexForward(true)
                    .build();

                return queryAll(request);

            } catch (DynamoDbException e) {
                logger.error("Failed to query practice sessions for rule {}", ruleId, e);
                throw new RepositoryException("Failed to query practice sessions by recurrence rule", e);
            }
        });
    }

    @Override
    public void deleteById(String sessionId) {
        performanceTracker.trackQuery("deletePracticeSession", TABLE_NAME, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyOf(sessionId))
                    .build());

                logger.debug("Deleted practice session {}", sessionId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete practice session {}", sessionId, e);
                throw new RepositoryException("Failed to delete practice session", e);
            }
        });
    }

    @Override
    public void deleteAll(List<PracticeSession> sessions) {
        if (sessions.isEmpty()) {
            return;
        }
        performanceTracker.trackQuery("batchDeletePracticeSessions", TABLE_NAME, () -> {
            List<WriteRequest> deletes = sessions.stream()
                .map(session -> WriteRequest.builder()
                    .deleteRequest(DeleteRequest.builder().key(keyOf(session.getSessionId())).build())
                    .build())
                .collect(Collectors.toList());

            writeInChunks(deletes, "delete");
            logger.debug("Deleted {} practice sessions", sessions.size());
            return null;
        });
    }

    private Map<String, AttributeValue> keyOf(String sessionId) {
        return Map.of(
            "pk", AttributeValue.builder().s(PracticeKeyFactory.getPracticePk(sessionId)).build(),
            "sk", AttributeValue.builder().s(PracticeKeyFactory.getMetadataSk()).build()
        );
    }

    private List<PracticeSession> queryAll(QueryRequest request) {
        List<PracticeSession> sessions = new ArrayList<>();
        Map<String, AttributeValue> lastKey = null;

        do {
            QueryRequest page = lastKey == null
                ? request
                : request.toBuilder().exclusiveStartKey(lastKey).build();
            QueryResponse response = dynamoDbClient.query(page);

            response.items().stream()
                .filter(item -> item.containsKey("pk") && PracticeKeyFactory.isPracticeItem(item.get("pk").s()))
                .map(sessionSchema::mapToItem)
                .forEach(sessions::add);

            lastKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                ? response.lastEvaluatedKey()
                : null;
        } while (lastKey != null);

        return sessions;
    }

    private void writeInChunks(List<WriteRequest> writes, String action) {
        for (int i = 0; i < writes.size(); i += BATCH_SIZE) {
            List<WriteRequest> chunk = writes.subList(i, Math.min(i + BATCH_SIZE, writes.size()));
            writeChunk(chunk, action, i / BATCH_SIZE);
        }
    }

    private void writeChunk(List<WriteRequest> chunk, String action, int chunkIndex) {
        Map<String, List<WriteRequest>> pending = Map.of(TABLE_NAME, chunk);

        try {
            for (int attempt = 1; attempt <= MAX_BATCH_ATTEMPTS; attempt++) {
                BatchWriteItemResponse response = dynamoDbClient.batchWriteItem(
                    BatchWriteItemRequest.builder().requestItems(pending).build());

                if (!response.hasUnprocessedItems() || response.unprocessedItems().isEmpty()) {
                    return;
                }
                pending = response.unprocessedItems();
                logger.warn("Batch {} chunk {} left {} unprocessed items (attempt {})",
                    action, chunkIndex, countWrites(pending), attempt);
            }
        } catch (DynamoDbException e) {
            logger.error("Batch {} of practice sessions failed at chunk {}", action, chunkIndex, e);
            throw new RepositoryException("Failed to " + action + " practice sessions", e);
        }

        throw new RepositoryException("Failed to " + action + " practice sessions: "
            + countWrites(pending) + " items left unprocessed");
    }

    private static int countWrites(Map<String, List<WriteRequest>> items) {
        return items.values().stream().map(List::size).reduce(0, Integer::sum);
    }
}
