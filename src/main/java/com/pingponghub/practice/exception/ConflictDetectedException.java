package com.pingponghub.practice.exception;

import com.pingponghub.practice.dto.ConflictRecord;

import java.util.List;

/**
 * Exception thrown when a submission would double-book the organizer's team.
 * Carries every colliding existing session so the caller can show them;
 * no session of the submission has been written.
 */
public class ConflictDetectedException extends RuntimeException {

    private final List<ConflictRecord> conflicts;
    
    public ConflictDetectedException(List<ConflictRecord> conflicts) {
        super(conflicts.size() + " existing practice(s) overlap the requested time");
        this.conflicts = List.copyOf(conflicts);
    }

    public List<ConflictRecord> getConflicts() {
        return conflicts;
    }
}
