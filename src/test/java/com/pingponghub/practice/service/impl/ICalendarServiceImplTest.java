package com.pingponghub.practice.service.impl;

import biweekly.Biweekly;
import biweekly.ICalendar;
import biweekly.component.VEvent;
import biweekly.property.Status;
import com.pingponghub.practice.dto.PracticeSessionDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ICalendarServiceImplTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    private ICalendarServiceImpl iCalendarService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), TOKYO);
        iCalendarService = new ICalendarServiceImpl(clock);
    }

    private static PracticeSessionDTO practice(String id, LocalDate date, String start, String end) {
        PracticeSessionDTO dto = new PracticeSessionDTO();
        dto.setSessionId(id);
        dto.setTeamName("Tigers");
        dto.setEventDate(date);
        dto.setStartTime(start);
        dto.setEndTime(end);
        dto.setLocation("City Gym");
        dto.setMaxParticipants(12);
        return dto;
    }

    @Test
    void generateICS_WithNoSessions_ReturnsEmptyCalendar() {
        // When
        String ics = iCalendarService.generateICS("Tigers", List.of());

        // Then
        assertThat(ics).contains("BEGIN:VCALENDAR");
        assertThat(ics).contains("X-WR-CALNAME:Tigers");
        assertThat(ics).contains("X-WR-TIMEZONE:Asia/Tokyo");
        assertThat(ics).doesNotContain("BEGIN:VEVENT");

        ICalendar parsed = Biweekly.parse(ics).first();
        assertThat(parsed.getEvents()).isEmpty();
    }

    @Test
    void generateICS_MapsSessionFields() {
        // Given
        PracticeSessionDTO dto = practice("session-1", LocalDate.of(2024, 2, 10), "14:00", "16:00");
        dto.setContent("Footwork drills");
        dto.setLevel("Intermediate");

        // When
        String ics = iCalendarService.generateICS("Tigers", List.of(dto));

        // Then
        ICalendar parsed = Biweekly.parse(ics).first();
        assertThat(parsed.getEvents()).hasSize(1);
        VEvent event = parsed.getEvents().get(0);

        assertThat(event.getUid().getValue()).isEqualTo("session-1@pingpong-hub");
        assertThat(event.getSummary().getValue()).isEqualTo("Practice - Tigers");
        assertThat(event.getLocation().getValue()).isEqualTo("City Gym");
        assertThat(event.getDescription().getValue()).isEqualTo("Footwork drills\nLevel: Intermediate");
        assertThat(event.getStatus().getValue()).isEqualTo(Status.confirmed().getValue());

        long expectedStart = LocalDateTime.of(2024, 2, 10, 14, 0).atZone(TOKYO).toInstant().toEpochMilli();
        long expectedEnd = LocalDateTime.of(2024, 2, 10, 16, 0).atZone(TOKYO).toInstant().toEpochMilli();
        assertThat(event.getDateStart().getValue().getTime()).isEqualTo(expectedStart);
        assertThat(event.getDateEnd().getValue().getTime()).isEqualTo(expectedEnd);
    }

    @Test
    void generateICS_WithoutFreeText_OmitsDescription() {
        String ics = iCalendarService.generateICS("Tigers",
            List.of(practice("session-1", LocalDate.of(2024, 2, 10), "14:00", "16:00")));

        VEvent event = Biweekly.parse(ics).first().getEvents().get(0);
        assertThat(event.getDescription()).isNull();
    }

    @Test
    void generateICS_SkipsSessionThatCannotBeConverted() {
        // Given
        PracticeSessionDTO broken = practice("broken", LocalDate.of(2024, 2, 10), null, "16:00");
        PracticeSessionDTO valid = practice("valid", LocalDate.of(2024, 2, 17), "14:00", "16:00");

        // When
        String ics = iCalendarService.generateICS("Tigers", List.of(broken, valid));

        // Then
        ICalendar parsed = Biweekly.parse(ics).first();
        assertThat(parsed.getEvents()).hasSize(1);
        assertThat(parsed.getEvents().get(0).getUid().getValue()).isEqualTo("valid@pingpong-hub");
    }
}
