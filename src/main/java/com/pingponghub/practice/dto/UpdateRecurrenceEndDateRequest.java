package com.pingponghub.practice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;

@Data
public class UpdateRecurrenceEndDateRequest {

    @NotNull(message = "End date is required")
    private LocalDate endDate;

    public UpdateRecurrenceEndDateRequest() {}

    public UpdateRecurrenceEndDateRequest(LocalDate endDate) {
        this.endDate = endDate;
    }
}
