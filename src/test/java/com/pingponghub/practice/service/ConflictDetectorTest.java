package com.pingponghub.practice.service;

import com.pingponghub.practice.dto.ConflictRecord;
import com.pingponghub.practice.model.OccurrenceSlot;
import com.pingponghub.practice.model.PracticeSession;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ConflictDetectorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 2, 10);

    private final ConflictDetector detector = new ConflictDetector();

    private static PracticeSession existing(LocalDate date, String start, String end) {
        PracticeSession session = new PracticeSession("org-1", "Tigers", date, start, end);
        session.setLocation("City Gym");
        return session;
    }

    @Test
    void detect_OverlappingSlotProducesRecord() {
        // Given
        List<OccurrenceSlot> candidates = List.of(new OccurrenceSlot(DAY, "15:00", "17:00"));
        List<PracticeSession> sessions = List.of(existing(DAY, "14:00", "16:00"));

        // When
        List<ConflictRecord> conflicts = detector.detect(candidates, sessions);

        // Then
        assertThat(conflicts).containsExactly(new ConflictRecord(DAY, "14:00", "16:00", "City Gym", "Tigers"));
    }

    @Test
    void detect_TouchingSlotIsNotAConflict() {
        List<ConflictRecord> conflicts = detector.detect(
            List.of(new OccurrenceSlot(DAY, "16:00", "18:00")),
            List.of(existing(DAY, "14:00", "16:00")));

        assertThat(conflicts).isEmpty();
    }

    @Test
    void detect_OtherDatesAreIgnored() {
        List<ConflictRecord> conflicts = detector.detect(
            List.of(new OccurrenceSlot(DAY.plusDays(1), "14:00", "16:00")),
            List.of(existing(DAY, "14:00", "16:00")));

        assertThat(conflicts).isEmpty();
    }

    @Test
    void detect_SameExistingSessionIsReportedOnce() {
        // Given two candidates on the same day both hitting one existing session
        List<OccurrenceSlot> candidates = List.of(
            new OccurrenceSlot(DAY, "13:00", "15:00"),
            new OccurrenceSlot(DAY, "15:00", "17:00"));

        // When
        List<ConflictRecord> conflicts = detector.detect(candidates, List.of(existing(DAY, "14:00", "16:00")));

        // Then
        assertThat(conflicts).hasSize(1);
    }

    @Test
    void detect_KeepsDiscoveryOrderAcrossDates() {
        LocalDate nextWeek = DAY.plusWeeks(1);
        List<OccurrenceSlot> candidates = List.of(
            new OccurrenceSlot(DAY, "10:00", "12:00"),
            new OccurrenceSlot(nextWeek, "10:00", "12:00"));
        List<PracticeSession> sessions = List.of(
            existing(nextWeek, "11:00", "13:00"),
            existing(DAY, "09:00", "10:30"));

        List<ConflictRecord> conflicts = detector.detect(candidates, sessions);

        assertThat(conflicts).extracting(ConflictRecord::date).containsExactly(DAY, nextWeek);
    }

    @Test
    void detect_EmptyInputsYieldNoConflicts() {
        assertThat(detector.detect(List.of(), List.of(existing(DAY, "14:00", "16:00")))).isEmpty();
        assertThat(detector.detect(List.of(new OccurrenceSlot(DAY, "14:00", "16:00")), List.of())).isEmpty();
    }
}
