package com.pingponghub.practice.service;

import com.pingponghub.practice.dto.SignupDTO;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Service interface for members joining and leaving practice sessions.
 */
public interface SignupService {

    /**
     * Signs the member up for one practice session, within its capacity.
     *
     * @param sessionId The practice session
     * @param userId The joining member
     * @param now Current local date-time, sessions that already started cannot be joined
     * @return The new sign-up
     * @throws com.pingponghub.practice.exception.ResourceNotFoundException if the session doesn't exist
     * @throws com.pingponghub.practice.exception.PastDatetimeException if the session already started
     * @throws com.pingponghub.practice.exception.CapacityExceededException if every place is taken
     * @throws com.pingponghub.practice.exception.AlreadySignedUpException if the member already joined
     */
    SignupDTO joinPractice(String sessionId, String userId, LocalDateTime now);

    /**
     * Withdraws the member from one practice session, freeing their place.
     *
     * @throws com.pingponghub.practice.exception.ResourceNotFoundException if the session doesn't exist
     *         or the member is not signed up
     */
    void cancelSignup(String sessionId, String userId);

    List<SignupDTO> listSignups(String sessionId);
}
