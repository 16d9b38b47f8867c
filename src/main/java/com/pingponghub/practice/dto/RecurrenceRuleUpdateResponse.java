package com.pingponghub.practice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Outcome of moving a series end date: how many occurrences were added or removed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecurrenceRuleUpdateResponse {
    private String ruleId;
    private LocalDate endDate;
    private int addedCount;
    private int removedCount;
}
