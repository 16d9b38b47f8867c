package com.pingponghub.practice.service.impl;

import biweekly.Biweekly;
import biweekly.ICalendar;
import biweekly.component.VEvent;
import biweekly.property.Method;
import biweekly.property.Status;
import biweekly.property.Uid;
import com.pingponghub.practice.dto.PracticeSessionDTO;
import com.pingponghub.practice.service.ICalendarService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Implementation of ICalendarService using Biweekly library.
 * Session dates and times are local to the zone of the injected clock.
 */
@Service
public class ICalendarServiceImpl implements ICalendarService {

    private static final Logger logger = LoggerFactory.getLogger(ICalendarServiceImpl.class);

    static final String UID_DOMAIN = "@pingpong-hub";
    static final String SUMMARY_PREFIX = "Practice - ";

    private final Clock clock;

    @Autowired
    public ICalendarServiceImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String generateICS(String calendarName, List<PracticeSessionDTO> sessions) {
        logger.debug("Generating ICS export {} with {} sessions", calendarName, sessions.size());

        ICalendar ical = new ICalendar();
        ical.setProductId("-//PingPong Hub//Practice Schedule//EN");
        ical.setMethod(Method.publish());
        ical.setExperimentalProperty("X-WR-CALNAME", calendarName);
        ical.setExperimentalProperty("X-WR-TIMEZONE", clock.getZone().getId());

        for (PracticeSessionDTO session : sessions) {
            try {
                ical.addEvent(toEvent(session));
            } catch (RuntimeException e) {
                // continue with the remaining sessions
                logger.warn("Skipping practice {} in ICS export: {}", session.getSessionId(), e.getMessage());
            }
        }

        String icsContent = Biweekly.write(ical).go();

        logger.debug("Generated ICS export with {} events", ical.getEvents().size());
        return icsContent;
    }

    private VEvent toEvent(PracticeSessionDTO session) {
        ZoneId zone = clock.getZone();
        VEvent event = new VEvent();

        event.setUid(new Uid(session.getSessionId() + UID_DOMAIN));
        event.setDateTimeStamp(Date.from(clock.instant()));
        event.setSummary(SUMMARY_PREFIX + session.getTeamName());

        event.setDateStart(Date.from(session.getStartDateTime().atZone(zone).toInstant()));
        event.setDateEnd(Date.from(session.getEndDateTime().atZone(zone).toInstant()));

        if (session.getLocation() != null) {
            event.setLocation(session.getLocation());
        }
        String description = buildDescription(session);
        if (!description.isEmpty()) {
            event.setDescription(description);
        }

        event.setStatus(Status.confirmed());
        event.setSequence(0);
        return event;
    }

    private String buildDescription(PracticeSessionDTO session) {
        List<String> lines = new ArrayList<>();
        if (hasText(session.getContent())) {
            lines.add(session.getContent().trim());
        }
        if (hasText(session.getLevel())) {
            lines.add("Level: " + session.getLevel().trim());
        }
        if (hasText(session.getConditions())) {
            lines.add("Conditions: " + session.getConditions().trim());
        }
        return String.join("\n", lines);
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
