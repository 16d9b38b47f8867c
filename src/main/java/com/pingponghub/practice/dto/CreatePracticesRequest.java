package com.pingponghub.practice.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;

/**
 * Request DTO for publishing a practice, optionally as a recurring series.
 * The event date is the anchor of the series.
 */
@Data
public class CreatePracticesRequest {

    @NotBlank(message = "Team name is required")
    private String teamName;

    @NotNull(message = "Event date is required")
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

    private RecurrenceType recurrenceType = RecurrenceType.NONE;

    /**
     * Inclusive last date of the series. Required unless recurrenceType is NONE.
     */
    private LocalDate recurrenceEndDate;
}
