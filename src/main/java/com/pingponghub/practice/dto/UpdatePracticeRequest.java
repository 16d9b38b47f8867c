package com.pingponghub.practice.dto;

import com.pingponghub.practice.model.OperationScope;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;

/**
 * Request DTO for editing a practice session or its whole series.
 */
@Data
public class UpdatePracticeRequest {

    @NotNull(message = "Scope is required")
    private OperationScope scope;

    /**
     * New date for this occurrence. Ignored for WHOLE_SERIES, where dates follow the rule.
     */
    private LocalDate eventDate;

    @NotBlank(message = "Start time is required")
    private String startTime;

    @NotBlank(message = "End time is required")
    private String endTime;

    @NotBlank(message = "Location is required")
    private String location;

    @NotNull(message = "Capacity is required")
    @Min(value = 1, message = "Capacity must be at least 1")
    private Integer maxParticipants;

    private String content;
    private String level;
    private String conditions;

    /**
     * Turn this occurrence into a one-off session. Only valid with SINGLE scope.
     */
    private boolean detachFromSeries;
}
