package com.pingponghub.practice.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.pingponghub.practice.model.RecurrenceKind;

import java.util.Locale;
import java.util.Optional;

/**
 * Recurrence choice on a submission; {@link #NONE} creates a one-off session.
 */
public enum RecurrenceType {
    NONE(null),
    WEEKLY(RecurrenceKind.WEEKLY),
    MONTHLY_FIXED_DATE(RecurrenceKind.MONTHLY_FIXED_DATE),
    MONTHLY_NTH_WEEKDAY(RecurrenceKind.MONTHLY_NTH_WEEKDAY);

    private final RecurrenceKind kind;

    RecurrenceType(RecurrenceKind kind) {
        this.kind = kind;
    }

    public Optional<RecurrenceKind> toKind() {
        return Optional.ofNullable(kind);
    }

    @JsonCreator
    public static RecurrenceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return RecurrenceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
