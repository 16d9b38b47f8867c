package com.pingponghub.practice.repository;

import com.pingponghub.practice.model.Signup;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for member sign-ups, stored in the partition of their practice session.
 */
public interface SignupRepository {

    /**
     * Atomically add the member's sign-up and increment the session's participant count.
     * Fails without writing anything when the session is full or the member already joined.
     *
     * @param sessionId The practice session
     * @param userId The joining member
     * @return The stored sign-up
     * @throws com.pingponghub.practice.exception.CapacityExceededException if the session is full
     * @throws com.pingponghub.practice.exception.AlreadySignedUpException if the member already joined
     * @throws com.pingponghub.practice.exception.ResourceNotFoundException if the session does not exist
     */
    Signup join(String sessionId, String userId);

    /**
     * Atomically remove the member's sign-up and decrement the session's participant count.
     *
     * @throws com.pingponghub.practice.exception.ResourceNotFoundException if the member is not signed up
     */
    void cancel(String sessionId, String userId);

    /**
     * Find every sign-up of a session, oldest first.
     */
    List<Signup> findBySessionId(String sessionId);

    /**
     * Delete every sign-up of the given sessions in chunks of 25. Not atomic.
     *
     * @return Number of sign-ups deleted
     */
    int deleteAllForSessions(Collection<String> sessionIds);
}
