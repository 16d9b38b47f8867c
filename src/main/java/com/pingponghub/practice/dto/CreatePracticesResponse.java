package com.pingponghub.practice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of a successful submission.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreatePracticesResponse {
    private int createdCount;
    private String recurrenceRuleId;    // null for a one-off session
    private List<String> sessionIds;
}
