package com.pingponghub.practice.util;

import com.pingponghub.practice.exception.ValidationException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless date and wall-clock helpers shared by recurrence expansion and conflict detection.
 * Weekdays are numbered 0 (Sunday) to 6 (Saturday); months 1 to 12.
 * Times are naive local "HH:MM" strings with minute resolution.
 */
public final class DateTimeUtils {

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");
    private static final int MAX_NTH_WEEK = 5;

    private DateTimeUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static int dayOfWeek(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    public static int daysInMonth(int year, int month) {
        return YearMonth.of(year, month).lengthOfMonth();
    }

    /**
     * Date of the n-th {@code weekday} in the given month.
     *
     * @param weekday 0 (Sunday) to 6 (Saturday)
     * @param n 1 to 5
     * @return empty when the month has fewer than {@code n} such weekdays, e.g. no 5th Friday
     */
    public static Optional<LocalDate> nthWeekdayOfMonth(int year, int month, int weekday, int n) {
        if (weekday < 0 || weekday > 6) {
            throw new IllegalArgumentException("Weekday must be between 0 and 6: " + weekday);
        }
        if (n < 1 || n > MAX_NTH_WEEK) {
            throw new IllegalArgumentException("Occurrence must be between 1 and 5: " + n);
        }

        LocalDate monthStart = LocalDate.of(year, month, 1);
        int daysUntilFirst = (weekday - dayOfWeek(monthStart) + 7) % 7;
        LocalDate candidate = monthStart.plusDays(daysUntilFirst + (n - 1) * 7L);

        if (candidate.getMonthValue() != month) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Which occurrence of its weekday the date is within its month: {@code ceil(day / 7)}, at most 5.
     */
    public static int nthWeekOf(LocalDate date) {
        return Math.min(MAX_NTH_WEEK, (date.getDayOfMonth() + 6) / 7);
    }

    /**
     * Half-open overlap of two wall-clock ranges. Ranges that only touch
     * (one ends at 10:00, the other starts at 10:00) do not overlap.
     */
    public static boolean timeRangesOverlap(String startA, String endA, String startB, String endB) {
        int a0 = toMinutes(startA);
        int a1 = toMinutes(endA);
        int b0 = toMinutes(startB);
        int b1 = toMinutes(endB);
        return a0 < b1 && a1 > b0;
    }

    public static int toMinutes(String time) {
        LocalTime parsed = parseTime(time);
        return parsed.getHour() * 60 + parsed.getMinute();
    }

    /**
     * Parse {@code H:MM}, {@code HH:MM} or {@code HH:MM:SS}; seconds are dropped.
     */
    public static LocalTime parseTime(String time) {
        if (time == null) {
            throw new ValidationException("Time is required");
        }
        Matcher matcher = TIME_PATTERN.matcher(time.trim());
        if (!matcher.matches()) {
            throw new ValidationException("Invalid time format (expected HH:MM): " + time);
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            throw new ValidationException("Time out of range: " + time);
        }
        return LocalTime.of(hour, minute);
    }

    public static String formatTime(LocalTime time) {
        return String.format("%02d:%02d", time.getHour(), time.getMinute());
    }

    public static String normalizeTime(String time) {
        return formatTime(parseTime(time));
    }
}
