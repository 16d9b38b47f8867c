package com.pingponghub.practice.service;

import com.pingponghub.practice.dto.CreatePracticesRequest;
import com.pingponghub.practice.dto.CreatePracticesResponse;
import com.pingponghub.practice.dto.PracticeSessionDTO;
import com.pingponghub.practice.dto.RecurrenceRuleUpdateResponse;
import com.pingponghub.practice.dto.UpdatePracticeRequest;
import com.pingponghub.practice.model.OperationScope;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Service interface for publishing and maintaining practice sessions and their series.
 * Every write refuses to double-book an organizer's team into overlapping slots.
 */
public interface PracticeSeriesService {

    /**
     * Publishes one practice, or every occurrence of a recurring series, as a single batch.
     * Either every occurrence is accepted or none is written.
     *
     * @param request The practice details and optional recurrence
     * @param organizerId The organizer publishing the practice
     * @param now Current local date-time, occurrences starting before it are rejected
     * @return Ids of the created rule and sessions
     * @throws com.pingponghub.practice.exception.ValidationException if a field is malformed
     * @throws com.pingponghub.practice.exception.PolicyCapExceededException if the series runs past this year
     * @throws com.pingponghub.practice.exception.NoEligibleDatesException if the pattern yields no date
     * @throws com.pingponghub.practice.exception.PastDatetimeException if any occurrence starts before now
     * @throws com.pingponghub.practice.exception.ConflictDetectedException if any occurrence overlaps an existing one
     * @throws com.pingponghub.practice.exception.RepositoryException if persistence fails
     */
    CreatePracticesResponse createPractices(CreatePracticesRequest request, String organizerId, LocalDateTime now);

    PracticeSessionDTO getPractice(String sessionId);

    /**
     * Lists an organizer's sessions for one team between two dates, both inclusive.
     */
    List<PracticeSessionDTO> listPractices(String organizerId, String teamName, LocalDate from, LocalDate to);

    /**
     * Moves the last date of a series. Moving it later generates the missing occurrences,
     * moving it earlier deletes the occurrences past the new end.
     *
     * @throws com.pingponghub.practice.exception.ResourceNotFoundException if the rule doesn't exist
     * @throws com.pingponghub.practice.exception.UnauthorizedException if the organizer doesn't own the rule
     */
    RecurrenceRuleUpdateResponse updateRecurrenceEndDate(String ruleId, LocalDate newEndDate,
                                                         String organizerId, LocalDateTime now);

    /**
     * Edits one occurrence or every occurrence of its series, depending on the request scope.
     *
     * @return The edited occurrence
     */
    PracticeSessionDTO updatePractice(String sessionId, UpdatePracticeRequest request,
                                      String organizerId, LocalDateTime now);

    /**
     * Deletes one occurrence, or the whole series together with its rule.
     */
    void deletePractice(String sessionId, OperationScope scope, String organizerId);
}
