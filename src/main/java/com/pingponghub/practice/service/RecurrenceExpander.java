package com.pingponghub.practice.service;

import com.pingponghub.practice.model.RecurrenceKind;
import com.pingponghub.practice.model.RecurrenceRule;
import com.pingponghub.practice.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns a recurrence pattern into the concrete dates of its occurrences.
 * Pure and stateless; safe to share between threads.
 */
@Component
public class RecurrenceExpander {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceExpander.class);

    /**
     * Expand a pattern between the anchor and the end date, both inclusive.
     *
     * @param anchor first occurrence, the date the pattern was derived from
     * @param end inclusive upper bound
     * @param kind recurrence pattern
     * @param dayOfWeek 0 (Sunday) to 6, used by MONTHLY_NTH_WEEKDAY
     * @param nthWeek 1 to 5, used by MONTHLY_NTH_WEEKDAY
     * @return sorted, distinct dates; only the anchor when {@code anchor > end}
     */
    public List<LocalDate> expand(LocalDate anchor, LocalDate end, RecurrenceKind kind, int dayOfWeek, int nthWeek) {
        if (anchor.isAfter(end)) {
            logger.warn("Recurrence anchor {} is after end date {}; producing the anchor only", anchor, end);
            return List.of(anchor);
        }
        return expandRange(anchor, end, kind, dayOfWeek, nthWeek);
    }

    /**
     * Expand a stored rule from its anchor up to {@code to} and keep the dates after {@code after}.
     * Used when a series end date moves later; an empty window yields no dates.
     * The anchor is always an existing occurrence, so it is never returned even when {@code after}
     * lies before it.
     */
    public List<LocalDate> expandAfter(RecurrenceRule rule, LocalDate after, LocalDate to) {
        if (!to.isAfter(after) || rule.getAnchorDate().isAfter(to)) {
            return List.of();
        }
        int dayOfWeek = rule.getDayOfWeek() != null
            ? rule.getDayOfWeek()
            : DateTimeUtils.dayOfWeek(rule.getAnchorDate());
        int nthWeek = rule.getNthWeek() != null
            ? rule.getNthWeek()
            : DateTimeUtils.nthWeekOf(rule.getAnchorDate());

        LocalDate lowerBound = after.isBefore(rule.getAnchorDate()) ? rule.getAnchorDate() : after;
        return expandRange(rule.getAnchorDate(), to, rule.getKind(), dayOfWeek, nthWeek).stream()
            .filter(date -> date.isAfter(lowerBound))
            .collect(Collectors.toList());
    }

    private List<LocalDate> expandRange(LocalDate anchor, LocalDate end, RecurrenceKind kind, int dayOfWeek, int nthWeek) {
        switch (kind) {
            case WEEKLY:
                return weekly(anchor, end);
            case MONTHLY_FIXED_DATE:
                return monthlyFixedDate(anchor, end);
            case MONTHLY_NTH_WEEKDAY:
                return monthlyNthWeekday(anchor, end, dayOfWeek, nthWeek);
            default:
                throw new IllegalArgumentException("Unsupported recurrence kind: " + kind);
        }
    }

    private List<LocalDate> weekly(LocalDate anchor, LocalDate end) {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = anchor; !d.isAfter(end); d = d.plusWeeks(1)) {
            dates.add(d);
        }
        return dates;
    }

    private List<LocalDate> monthlyFixedDate(LocalDate anchor, LocalDate end) {
        int dayOfMonth = anchor.getDayOfMonth();
        List<LocalDate> dates = new ArrayList<>();

        LocalDate month = anchor.withDayOfMonth(1);
        while (true) {
            int day = Math.min(dayOfMonth, DateTimeUtils.daysInMonth(month.getYear(), month.getMonthValue()));
            LocalDate candidate = month.withDayOfMonth(day);
            if (candidate.isAfter(end)) {
                break;
            }
            // candidates before the anchor are not occurrences
            if (!candidate.isBefore(anchor)) {
                dates.add(candidate);
            }
            month = month.plusMonths(1);
        }
        return dates;
    }

    private List<LocalDate> monthlyNthWeekday(LocalDate anchor, LocalDate end, int dayOfWeek, int nthWeek) {
        TreeSet<LocalDate> dates = new TreeSet<>();

        for (int year = anchor.getYear(); year <= end.getYear(); year++) {
            int firstMonth = year == anchor.getYear() ? anchor.getMonthValue() : 1;
            int lastMonth = year == end.getYear() ? end.getMonthValue() : 12;
            for (int month = firstMonth; month <= lastMonth; month++) {
                DateTimeUtils.nthWeekdayOfMonth(year, month, dayOfWeek, nthWeek)
                    .filter(candidate -> !candidate.isBefore(anchor) && !candidate.isAfter(end))
                    .ifPresent(dates::add);
            }
        }
        return new ArrayList<>(dates);
    }
}
