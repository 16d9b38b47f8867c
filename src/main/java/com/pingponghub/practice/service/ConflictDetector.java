package com.pingponghub.practice.service;

import com.pingponghub.practice.dto.ConflictRecord;
import com.pingponghub.practice.model.OccurrenceSlot;
import com.pingponghub.practice.model.PracticeSession;
import com.pingponghub.practice.util.DateTimeUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Finds existing sessions that a batch of new occurrences would overlap.
 * <p>
 * Callers pass only the existing sessions of the same organizer and team on the
 * candidate dates. The check is advisory: two concurrent submissions can both
 * pass it before either is written.
 */
@Component
public class ConflictDetector {

    /**
     * @return one record per colliding existing session, in discovery order; empty when the batch is clear
     */
    public List<ConflictRecord> detect(List<OccurrenceSlot> candidates, List<PracticeSession> existing) {
        if (candidates.isEmpty() || existing.isEmpty()) {
            return List.of();
        }

        Map<LocalDate, List<PracticeSession>> existingByDate = existing.stream()
            .collect(Collectors.groupingBy(PracticeSession::getEventDate, LinkedHashMap::new, Collectors.toList()));

        Map<String, ConflictRecord> conflicts = new LinkedHashMap<>();
        for (OccurrenceSlot candidate : candidates) {
            for (PracticeSession session : existingByDate.getOrDefault(candidate.date(), List.of())) {
                if (DateTimeUtils.timeRangesOverlap(
                        candidate.startTime(), candidate.endTime(),
                        session.getStartTime(), session.getEndTime())) {
                    ConflictRecord record = ConflictRecord.from(session);
                    conflicts.putIfAbsent(record.key(), record);
                    // one collision is enough to block this candidate
                    break;
                }
            }
        }
        return new ArrayList<>(conflicts.values());
    }
}
