package com.pingponghub.practice.model;

import java.time.LocalDate;

/**
 * Date and wall-clock range of an occurrence that is about to be written.
 */
public record OccurrenceSlot(LocalDate date, String startTime, String endTime) {
}
