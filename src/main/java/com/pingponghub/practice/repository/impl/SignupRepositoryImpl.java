package com.pingponghub.practice.repository.impl;

import com.pingponghub.practice.exception.AlreadySignedUpException;
import com.pingponghub.practice.exception.CapacityExceededException;
import com.pingponghub.practice.exception.RepositoryException;
import com.pingponghub.practice.exception.ResourceNotFoundException;
import com.pingponghub.practice.model.Signup;
import com.pingponghub.practice.repository.SignupRepository;
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
import java.util.*;
import java.util.stream.Collectors;

import static com.pingponghub.practice.util.PracticeKeyFactory.TABLE_NAME;

/**
 * DynamoDB implementation of SignupRepository.
 * Joining and cancelling are transactions over the sign-up item and the session's participant count.
 */
@Repository
public class SignupRepositoryImpl implements SignupRepository {

    private static final Logger logger = LoggerFactory.getLogger(SignupRepositoryImpl.class);

    static final int BATCH_SIZE = 25;
    private static final int MAX_BATCH_ATTEMPTS = 3;
    private static final String CONDITION_FAILED = "ConditionalCheckFailed";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Signup> signupSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public SignupRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.signupSchema = TableSchema.fromBean(Signup.class);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Signup join(String sessionId, String userId) {
        return performanceTracker.trackQuery("joinPracticeSession", TABLE_NAME, () -> {
            Signup signup = new Signup(sessionId, userId);

            // 1. Increment the participant count while it is below capacity
            TransactWriteItem incrementCount = TransactWriteItem.builder()
                .update(Update.builder()
                    .tableName(TABLE_NAME)
                    .key(sessionKey(sessionId))
                    .updateExpression("SET participantCount = participantCount + :one, updatedAt = :now")
                    .conditionExpression("attribute_exists(pk) AND participantCount < maxParticipants")
                    .expressionAttributeValues(Map.of(
                        ":one", AttributeValue.builder().n("1").build(),
                        ":now", AttributeValue.builder().n(String.valueOf(Instant.now().toEpochMilli())).build()
                    ))
                    .returnValuesOnConditionCheckFailure(ReturnValuesOnConditionCheckFailure.ALL_OLD)
                    .build())
                .build();

            // 2. Put the sign-up unless the member already has one
            TransactWriteItem putSignup = TransactWriteItem.builder()
                .put(Put.builder()
                    .tableName(TABLE_NAME)
                    .item(signupSchema.itemToMap(signup, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build())
                .build();

            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(incrementCount, putSignup)
                    .build());

                logger.debug("User {} joined practice session {}", userId, sessionId);
                return signup;

            } catch (TransactionCanceledException e) {
                throw translateJoinFailure(e, sessionId, userId);
            } catch (DynamoDbException e) {
                logger.error("Failed to join user {} to practice session {}", userId, sessionId, e);
                throw new RepositoryException("Failed to join practice session", e);
            }
        });
    }

    @Override
    public void cancel(String sessionId, String userId) {
        performanceTracker.trackQuery("cancelPracticeSignup", TABLE_NAME, () -> {
            TransactWriteItem deleteSignup = TransactWriteItem.builder()
                .delete(Delete.builder()
                    .tableName(TABLE_NAME)
                    .key(signupKey(sessionId, userId))
                    .conditionExpression("attribute_exists(pk)")
                    .build())
                .build();

            TransactWriteItem decrementCount = TransactWriteItem.builder()
                .update(Update.builder()
                    .tableName(TABLE_NAME)
                    .key(sessionKey(sessionId))
                    .updateExpression("SET participantCount = participantCount - :one, updatedAt = :now")
                    .conditionExpression("attribute_exists(pk) AND participantCount > :zero")
                    .expressionAttributeValues(Map.of(
                        ":one", AttributeValue.builder().n("1").build(),
                        ":zero", AttributeValue.builder().n("0").build(),
                        ":now", AttributeValue.builder().n(String.valueOf(Instant.now().toEpochMilli())).build()
                    ))
                    .build())
                .build();

            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(deleteSignup, decrementCount)
                    .build());

                logger.debug("User {} cancelled sign-up for practice session {}", userId, sessionId);
                return null;

            } catch (TransactionCanceledException e) {
                if (conditionFailed(e, 0)) {
                    throw new ResourceNotFoundException("User " + userId + " is not signed up for practice " + sessionId);
                }
                logger.error("Cancelling sign-up of user {} for practice session {} was rejected: {}",
                    userId, sessionId, e.getMessage());
                throw new RepositoryException("Failed to cancel sign-up", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to cancel sign-up of user {} for practice session {}", userId, sessionId, e);
                throw new RepositoryException("Failed to cancel sign-up", e);
            }
        });
    }

    @Override
    public List<Signup> findBySessionId(String sessionId) {
        return performanceTracker.trackQuery("findSignupsBySession", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("pk = :pk AND begins_with(sk, :signupPrefix)")
                    .expressionAttributeValues(Map.of(
                        ":pk", AttributeValue.builder().s(PracticeKeyFactory.getPracticePk(sessionId)).build(),
                        ":signupPrefix", AttributeValue.builder().s(PracticeKeyFactory.SIGNUP_PREFIX + "#").build()
                    ))
                    .build();

                return queryAll(request).stream()
                    .sorted(Comparator.comparing(Signup::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                    .collect(Collectors.toList());

            } catch (DynamoDbException e) {
                logger.error("Failed to query sign-ups for practice session {}", sessionId, e);
                throw new RepositoryException("Failed to query sign-ups", e);
            }
        });
    }

    @Override
    public int deleteAllForSessions(Collection<String> sessionIds) {
        if (sessionIds.isEmpty()) {
            return 0;
        }
        return performanceTracker.trackQuery("batchDeleteSignups", TABLE_NAME, () -> {
            List<WriteRequest> deletes = new ArrayList<>();
            for (String sessionId : sessionIds) {
                for (Signup signup : findBySessionId(sessionId)) {
                    deletes.add(WriteRequest.builder()
                        .deleteRequest(DeleteRequest.builder().key(signupKey(sessionId, signup.getUserId())).build())
                        .build());
                }
            }

            for (int i = 0; i < deletes.size(); i += BATCH_SIZE) {
                writeChunk(deletes.subList(i, Math.min(i + BATCH_SIZE, deletes.size())), i / BATCH_SIZE);
            }
            logger.debug("Deleted {} sign-ups across {} practice sessions", deletes.size(), sessionIds.size());
            return deletes.size();
        });
    }

    private RuntimeException translateJoinFailure(TransactionCanceledException e, String sessionId, String userId) {
        if (conditionFailed(e, 1)) {
            return new AlreadySignedUpException("User " + userId + " already joined practice " + sessionId);
        }
        if (conditionFailed(e, 0)) {
            Map<String, AttributeValue> session = e.cancellationReasons().get(0).item();
            if (session == null || session.isEmpty()) {
                return new ResourceNotFoundException("Practice not found: " + sessionId);
            }
            return new CapacityExceededException(String.format("This practice is full (%s/%s places taken)",
                numberOrUnknown(session, "participantCount"), numberOrUnknown(session, "maxParticipants")));
        }
        logger.error("Joining user {} to practice session {} was rejected: {}", userId, sessionId, e.getMessage());
        return new RepositoryException("Failed to join practice session", e);
    }

    private static String numberOrUnknown(Map<String, AttributeValue> item, String attribute) {
        AttributeValue value = item.get(attribute);
        return value != null && value.n() != null ? value.n() : "?";
    }

    private static boolean conditionFailed(TransactionCanceledException e, int index) {
        return e.hasCancellationReasons()
            && e.cancellationReasons().size() > index
            && CONDITION_FAILED.equals(e.cancellationReasons().get(index).code());
    }

    private Map<String, AttributeValue> sessionKey(String sessionId) {
        return Map.of(
            "pk", AttributeValue.builder().s(PracticeKeyFactory.getPracticePk(sessionId)).build(),
            "sk", AttributeValue.builder().s(PracticeKeyFactory.getMetadataSk()).build()
        );
    }

    private Map<String, AttributeValue> signupKey(String sessionId, String userId) {
        return Map.of(
            "pk", AttributeValue.builder().s(PracticeKeyFactory.getPracticePk(sessionId)).build(),
            "sk", AttributeValue.builder().s(PracticeKeyFactory.getSignupSk(userId)).build()
        );
    }

    private List<Signup> queryAll(QueryRequest request) {
        List<Signup> signups = new ArrayList<>();
        Map<String, AttributeValue> lastKey = null;

        do {
            QueryRequest page = lastKey == null
                ? request
                : request.toBuilder().exclusiveStartKey(lastKey).build();
            QueryResponse response = dynamoDbClient.query(page);

            response.items().stream()
                .filter(item -> item.containsKey("sk") && PracticeKeyFactory.isSignupItem(item.get("sk").s()))
                .map(signupSchema::mapToItem)
                .forEach(signups::add);

            lastKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                ? response.lastEvaluatedKey()
                : null;
        } while (lastKey != null);

        return signups;
    }

    private void writeChunk(List<WriteRequest> chunk, int chunkIndex) {
        Map<String, List<WriteRequest>> pending = Map.of(TABLE_NAME, chunk);

        try {
            for (int attempt = 1; attempt <= MAX_BATCH_ATTEMPTS; attempt++) {
                BatchWriteItemResponse response = dynamoDbClient.batchWriteItem(
                    BatchWriteItemRequest.builder().requestItems(pending).build());

                if (!response.hasUnprocessedItems() || response.unprocessedItems().isEmpty()) {
                    return;
                }
                pending = response.unprocessedItems();
                logger.warn("Sign-up delete chunk {} left {} unprocessed items (attempt {})",
                    chunkIndex, pending.get(TABLE_NAME).size(), attempt);
            }
        } catch (DynamoDbException e) {
            logger.error("Batch delete of sign-ups failed at chunk {}", chunkIndex, e);
            throw new RepositoryException("Failed to delete sign-ups", e);
        }

        throw new RepositoryException("Failed to delete sign-ups: "
            + pending.get(TABLE_NAME).size() + " items left unprocessed");
    }
}
