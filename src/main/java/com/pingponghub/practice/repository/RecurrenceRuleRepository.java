package com.pingponghub.practice.repository;

import com.pingponghub.practice.model.RecurrenceRule;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Repository interface for recurrence rules in the PracticeTable.
 */
public interface RecurrenceRuleRepository {

    RecurrenceRule save(RecurrenceRule rule);

    Optional<RecurrenceRule> findById(String ruleId);

    /**
     * Change only the end date of an existing rule.
     * 
     * @throws com.pingponghub.practice.exception.ResourceNotFoundException if the rule does not exist
     */
    void updateEndDate(String ruleId, LocalDate endDate);

    /**
     * Delete a rule by id. Idempotent.
     */
    void deleteById(String ruleId);
}
