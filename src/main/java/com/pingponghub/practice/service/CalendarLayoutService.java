package com.pingponghub.practice.service;

import com.pingponghub.practice.dto.MonthLayout;
import com.pingponghub.practice.dto.WeekLayout;
import com.pingponghub.practice.model.TimedEvent;
import com.pingponghub.practice.model.WeekWindow;

import java.time.LocalDate;
import java.util.List;

/**
 * Places timed events on month and week grids. No I/O.
 */
public interface CalendarLayoutService {

    /**
     * Lays out a month as exactly six Monday-first weeks.
     *
     * @param year Calendar year
     * @param month Month index, 0-based (January = 0)
     * @param events Events to place; those starting outside the month are ignored
     * @throws com.pingponghub.practice.exception.ValidationException if the month index is out of range
     */
    <E extends TimedEvent> MonthLayout<E> monthLayout(int year, int month, List<E> events);

    /**
     * Computes grid coordinates for the events starting in the seven days from {@code weekStart}
     * and within the visible hours of {@code window}.
     */
    <E extends TimedEvent> WeekLayout<E> weekLayout(LocalDate weekStart, WeekWindow window, List<E> events);
}
