package com.pingponghub.practice.dto;

import com.pingponghub.practice.model.PracticeSession;

import java.time.LocalDate;

/**
 * An existing session that a submitted occurrence would double-book.
 * Only lives for the duration of one submission and is never stored.
 */
public record ConflictRecord(LocalDate date, String startTime, String endTime, String location, String teamName) {

    public static ConflictRecord from(PracticeSession existing) {
        return new ConflictRecord(
            existing.getEventDate(),
            existing.getStartTime(),
            existing.getEndTime(),
            existing.getLocation(),
            existing.getTeamName()
        );
    }

    /**
     * Identity used to collapse repeated hits on the same existing session.
     */
    public String key() {
        return date + "|" + startTime + "|" + endTime;
    }
}
