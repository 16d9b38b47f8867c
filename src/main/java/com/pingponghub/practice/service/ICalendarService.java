package com.pingponghub.practice.service;

import com.pingponghub.practice.dto.PracticeSessionDTO;

import java.util.List;

/**
 * Service for generating iCalendar (ICS) exports of practice sessions,
 * importable into iOS Calendar, Google Calendar and other calendar applications.
 */
public interface ICalendarService {

    /**
     * Generate an ICS document with one event per practice session.
     *
     * @param calendarName Display name of the calendar (X-WR-CALNAME)
     * @param sessions Sessions to export, sorted by date and start time
     * @return ICS formatted string conforming to RFC 5545 (iCalendar)
     */
    String generateICS(String calendarName, List<PracticeSessionDTO> sessions);
}
