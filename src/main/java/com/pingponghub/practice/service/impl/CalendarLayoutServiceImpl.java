package com.pingponghub.practice.service.impl;

import com.pingponghub.practice.dto.MonthCell;
import com.pingponghub.practice.dto.MonthLayout;
import com.pingponghub.practice.dto.WeekLayout;
import com.pingponghub.practice.dto.WeekPlacement;
import com.pingponghub.practice.exception.ValidationException;
import com.pingponghub.practice.model.TimedEvent;
import com.pingponghub.practice.model.WeekWindow;
import com.pingponghub.practice.service.CalendarLayoutService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class CalendarLayoutServiceImpl implements CalendarLayoutService {

    private static final Logger logger = LoggerFactory.getLogger(CalendarLayoutServiceImpl.class);

    static final int WEEKS_PER_MONTH_GRID = 6;
    static final int DAYS_PER_WEEK = 7;

    @Override
    public <E extends TimedEvent> MonthLayout<E> monthLayout(int year, int month, List<E> events) {
        if (month < 0 || month > 11) {
            throw new ValidationException("Month must be between 0 and 11: " + month);
        }
        LocalDate first = LocalDate.of(year, month + 1, 1);
        int leadingBlanks = first.getDayOfWeek().getValue() - 1;
        int length = first.lengthOfMonth();

        List<MonthCell<E>> cells = new ArrayList<>();
        for (int i = 0; i < WEEKS_PER_MONTH_GRID * DAYS_PER_WEEK; i++) {
            int day = i - leadingBlanks + 1;
            cells.add(day >= 1 && day <= length ? new MonthCell<>(first.withDayOfMonth(day)) : null);
        }

        sortedByStart(events).forEach(event -> {
            LocalDate date = event.getStartDateTime().toLocalDate();
            if (date.getYear() == year && date.getMonthValue() == month + 1) {
                cells.get(leadingBlanks + date.getDayOfMonth() - 1).getEvents().add(event);
            }
        });

        List<List<MonthCell<E>>> weeks = new ArrayList<>();
        for (int w = 0; w < WEEKS_PER_MONTH_GRID; w++) {
            weeks.add(new ArrayList<>(cells.subList(w * DAYS_PER_WEEK, (w + 1) * DAYS_PER_WEEK)));
        }
        return new MonthLayout<>(year, month, weeks);
    }

    @Override
    public <E extends TimedEvent> WeekLayout<E> weekLayout(LocalDate weekStart, WeekWindow window, List<E> events) {
        int windowStartMinutes = window.startHour() * 60;
        int windowEndMinutes = window.endHour() * 60;

        List<WeekPlacement<E>> placements = new ArrayList<>();
        for (E event : sortedByStart(events)) {
            LocalDateTime start = event.getStartDateTime();
            long dayIndex = ChronoUnit.DAYS.between(weekStart, start.toLocalDate());
            if (dayIndex < 0 || dayIndex >= DAYS_PER_WEEK) {
                continue;
            }

            int minuteOfDay = start.getHour() * 60 + start.getMinute();
            if (minuteOfDay < windowStartMinutes || minuteOfDay >= windowEndMinutes) {
                logger.debug("Event at {} falls outside the visible hours {}-{}", start,
                    window.startHour(), window.endHour());
                continue;
            }

            int slotIndex = (minuteOfDay - windowStartMinutes) / window.slotMinutes();
            long minutes = Duration.between(start, event.getEndDateTime()).toMinutes();
            int durationSlots = (int) Math.max(1, Math.round((double) minutes / window.slotMinutes()));

            placements.add(new WeekPlacement<>(event, (int) dayIndex, slotIndex, durationSlots));
        }
        return new WeekLayout<>(weekStart, window, placements);
    }

    private static <E extends TimedEvent> List<E> sortedByStart(List<E> events) {
        List<E> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(TimedEvent::getStartDateTime));
        return sorted;
    }
}
