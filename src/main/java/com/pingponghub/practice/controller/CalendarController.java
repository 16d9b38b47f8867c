package com.pingponghub.practice.controller;

import com.pingponghub.practice.config.WeekViewProperties;
import com.pingponghub.practice.dto.MonthLayout;
import com.pingponghub.practice.dto.PracticeSessionDTO;
import com.pingponghub.practice.dto.WeekLayout;
import com.pingponghub.practice.exception.ValidationException;
import com.pingponghub.practice.service.CalendarLayoutService;
import com.pingponghub.practice.service.ICalendarService;
import com.pingponghub.practice.service.PracticeSeriesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

/**
 * REST controller for calendar views of an organizer's team practices.
 *
 * GET /calendar/month, /calendar/week and /calendar/feed.ics
 */
@RestController
@RequestMapping("/calendar")
@Tag(name = "Calendar", description = "Month and week grids and iCalendar export")
public class CalendarController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(CalendarController.class);

    static final String ICS_CONTENT_TYPE = "text/calendar; charset=utf-8";

    private final PracticeSeriesService practiceSeriesService;
    private final CalendarLayoutService calendarLayoutService;
    private final ICalendarService iCalendarService;
    private final WeekViewProperties weekViewProperties;
    private final Clock clock;

    @Autowired
    public CalendarController(PracticeSeriesService practiceSeriesService,
                              CalendarLayoutService calendarLayoutService,
                              ICalendarService iCalendarService,
                              WeekViewProperties weekViewProperties,
                              Clock clock) {
        this.practiceSeriesService = practiceSeriesService;
        this.calendarLayoutService = calendarLayoutService;
        this.iCalendarService = iCalendarService;
        this.weekViewProperties = weekViewProperties;
        this.clock = clock;
    }

    /**
     * Month grid; {@code month} is 0-based.
     */
    @GetMapping("/month")
    @Operation(summary = "Month grid of six Monday-first weeks")
    public ResponseEntity<MonthLayout<PracticeSessionDTO>> getMonth(
            @RequestParam("team") String teamName,
            @RequestParam int year,
            @RequestParam int month,
            HttpServletRequest httpRequest) {

        String organizerId = extractOrganizerId(httpRequest);
        if (month < 0 || month > 11) {
            throw new ValidationException("Month must be between 0 and 11: " + month);
        }
        LocalDate first = LocalDate.of(year, month + 1, 1);
        List<PracticeSessionDTO> practices = practiceSeriesService.listPractices(
            organizerId, teamName, first, first.with(TemporalAdjusters.lastDayOfMonth()));

        return ResponseEntity.ok(calendarLayoutService.monthLayout(year, month, practices));
    }

    /**
     * Week grid starting on the Monday on or before {@code weekStart}.
     */
    @GetMapping("/week")
    @Operation(summary = "Week grid with day and slot coordinates")
    public ResponseEntity<WeekLayout<PracticeSessionDTO>> getWeek(
            @RequestParam("team") String teamName,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart,
            HttpServletRequest httpRequest) {

        String organizerId = extractOrganizerId(httpRequest);
        LocalDate monday = weekStart.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        List<PracticeSessionDTO> practices = practiceSeriesService.listPractices(
            organizerId, teamName, monday, monday.plusDays(6));

        return ResponseEntity.ok(calendarLayoutService.weekLayout(monday, weekViewProperties.toWindow(), practices));
    }

    /**
     * iCalendar export of a team's practices, from today for one year unless a range is given.
     */
    @GetMapping(value = "/feed.ics", produces = ICS_CONTENT_TYPE)
    @Operation(summary = "Download practices as an .ics file")
    public ResponseEntity<String> getFeed(
            @RequestParam("team") String teamName,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            HttpServletRequest httpRequest) {

        String organizerId = extractOrganizerId(httpRequest);
        LocalDate start = from != null ? from : LocalDate.now(clock);
        LocalDate end = to != null ? to : start.plusYears(1);

        List<PracticeSessionDTO> practices = practiceSeriesService.listPractices(organizerId, teamName, start, end);
        logger.debug("Exporting {} practices of team {} for organizer {}", practices.size(), teamName, organizerId);

        String ics = iCalendarService.generateICS(teamName, practices);
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"pingpong-hub-practices.ics\"")
            .header(HttpHeaders.CONTENT_TYPE, ICS_CONTENT_TYPE)
            .body(ics);
    }
}
