package com.pingponghub.practice.repository;

import com.pingponghub.practice.model.PracticeSession;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for practice sessions in the PracticeTable.
 */
public interface PracticeSessionRepository {

    /**
     * Save a single session (upsert).
     * 
     * @param session The session to save
     * @return The saved session
     */
    PracticeSession save(PracticeSession session);

    /**
     * Write a batch of sessions in chunks of 25.
     * Not atomic: when a later chunk fails, earlier chunks stay written.
     * 
     * @param sessions The sessions to write
     * @throws com.pingponghub.practice.exception.RepositoryException if any chunk cannot be written
     */
    void saveAll(List<PracticeSession> sessions);

    Optional<PracticeSession> findById(String sessionId);

    /**
     * Find the sessions an organizer runs for one team on any of the given dates.
     * Uses OrganizerTeamIndex over the span of the dates and keeps only exact date matches.
     * 
     * @param organizerId The organizer
     * @param teamName The team label
     * @param dates Dates of interest
     * @return Matching sessions ordered by date and start time
     */
    List<PracticeSession> findByOrganizerAndTeamOnDates(String organizerId, String teamName, Collection<LocalDate> dates);

    /**
     * Find the sessions an organizer runs for one team between two dates, both inclusive.
     */
    List<PracticeSession> findByOrganizerAndTeamBetween(String organizerId, String teamName, LocalDate from, LocalDate to);

    /**
     * Find every occurrence generated by a recurrence rule, ordered by date.
     */
    List<PracticeSession> findByRecurrenceRuleId(String ruleId);

    /**
     * Delete a session by id. Idempotent.
     */
    void deleteById(String sessionId);

    /**
     * Delete a batch of sessions in chunks of 25. Not atomic.
     */
    void deleteAll(List<PracticeSession> sessions);
}
