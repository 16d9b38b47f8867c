package com.pingponghub.practice.dto;

import com.pingponghub.practice.model.PracticeSession;
import com.pingponghub.practice.model.TimedEvent;
import com.pingponghub.practice.util.DateTimeUtils;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Read model of a practice session, also the event type placed on calendar grids.
 */
@Data
@NoArgsConstructor
public class PracticeSessionDTO implements TimedEvent {
    private String sessionId;
    private String teamName;
    private LocalDate eventDate;
    private String startTime;
    private String endTime;
    private String location;
    private int maxParticipants;
    private int participantCount;
    private String content;
    private String level;
    private String conditions;
    private String recurrenceRuleId;

    public PracticeSessionDTO(PracticeSession session) {
        this.sessionId = session.getSessionId();
        this.teamName = session.getTeamName();
        this.eventDate = session.getEventDate();
        this.startTime = session.getStartTime();
        this.endTime = session.getEndTime();
        this.location = session.getLocation();
        this.maxParticipants = session.getMaxParticipants();
        this.participantCount = session.getParticipantCount();
        this.content = session.getContent();
        this.level = session.getLevel();
        this.conditions = session.getConditions();
        this.recurrenceRuleId = session.getRecurrenceRuleId();
    }

    @Override
    public LocalDateTime getStartDateTime() {
        return eventDate.atTime(DateTimeUtils.parseTime(startTime));
    }

    @Override
    public LocalDateTime getEndDateTime() {
        return eventDate.atTime(DateTimeUtils.parseTime(endTime));
    }
}
