package com.pingponghub.practice.util;

import com.pingponghub.practice.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.*;

class DateTimeUtilsTest {

    @Test
    void dayOfWeek_SundayIsZeroAndSaturdayIsSix() {
        assertThat(DateTimeUtils.dayOfWeek(LocalDate.of(2024, 1, 7))).isEqualTo(0);
        assertThat(DateTimeUtils.dayOfWeek(LocalDate.of(2024, 1, 1))).isEqualTo(1);
        assertThat(DateTimeUtils.dayOfWeek(LocalDate.of(2024, 1, 6))).isEqualTo(6);
    }

    @Test
    void daysInMonth_HandlesLeapFebruary() {
        assertThat(DateTimeUtils.daysInMonth(2024, 2)).isEqualTo(29);
        assertThat(DateTimeUtils.daysInMonth(2023, 2)).isEqualTo(28);
        assertThat(DateTimeUtils.daysInMonth(2024, 4)).isEqualTo(30);
        assertThat(DateTimeUtils.daysInMonth(2024, 12)).isEqualTo(31);
    }

    @Test
    void nthWeekdayOfMonth_FindsSecondTuesday() {
        // Tuesdays of February 2024: 6, 13, 20, 27
        assertThat(DateTimeUtils.nthWeekdayOfMonth(2024, 2, 2, 2))
            .contains(LocalDate.of(2024, 2, 13));
    }

    @Test
    void nthWeekdayOfMonth_FirstDayOfMonthIsTheWeekday() {
        // 2024-01-01 is a Monday
        assertThat(DateTimeUtils.nthWeekdayOfMonth(2024, 1, 1, 1))
            .contains(LocalDate.of(2024, 1, 1));
    }

    @Test
    void nthWeekdayOfMonth_MissingFifthOccurrenceIsEmpty() {
        // February 2024 has only four Mondays
        assertThat(DateTimeUtils.nthWeekdayOfMonth(2024, 2, 1, 5)).isEmpty();
        assertThat(DateTimeUtils.nthWeekdayOfMonth(2024, 1, 1, 5)).contains(LocalDate.of(2024, 1, 29));
    }

    @Test
    void nthWeekdayOfMonth_RejectsOutOfRangeArguments() {
        assertThatThrownBy(() -> DateTimeUtils.nthWeekdayOfMonth(2024, 1, 7, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DateTimeUtils.nthWeekdayOfMonth(2024, 1, 1, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nthWeekOf_IsCeilingOfDayOverSeven() {
        assertThat(DateTimeUtils.nthWeekOf(LocalDate.of(2024, 1, 1))).isEqualTo(1);
        assertThat(DateTimeUtils.nthWeekOf(LocalDate.of(2024, 1, 7))).isEqualTo(1);
        assertThat(DateTimeUtils.nthWeekOf(LocalDate.of(2024, 1, 8))).isEqualTo(2);
        assertThat(DateTimeUtils.nthWeekOf(LocalDate.of(2024, 1, 29))).isEqualTo(5);
        assertThat(DateTimeUtils.nthWeekOf(LocalDate.of(2024, 1, 31))).isEqualTo(5);
    }

    @Test
    void timeRangesOverlap_PartialOverlapIsDetected() {
        assertThat(DateTimeUtils.timeRangesOverlap("14:00", "16:00", "15:00", "17:00")).isTrue();
        assertThat(DateTimeUtils.timeRangesOverlap("15:00", "17:00", "14:00", "16:00")).isTrue();
    }

    @Test
    void timeRangesOverlap_TouchingRangesDoNotOverlap() {
        assertThat(DateTimeUtils.timeRangesOverlap("14:00", "16:00", "16:00", "18:00")).isFalse();
        assertThat(DateTimeUtils.timeRangesOverlap("16:00", "18:00", "14:00", "16:00")).isFalse();
    }

    @Test
    void timeRangesOverlap_ContainedRangeOverlaps() {
        assertThat(DateTimeUtils.timeRangesOverlap("09:00", "12:00", "10:00", "10:30")).isTrue();
    }

    @Test
    void parseTime_AcceptsShortAndSecondsForms() {
        assertThat(DateTimeUtils.parseTime("9:05")).isEqualTo(LocalTime.of(9, 5));
        assertThat(DateTimeUtils.parseTime("09:05:30")).isEqualTo(LocalTime.of(9, 5));
        assertThat(DateTimeUtils.normalizeTime("9:00")).isEqualTo("09:00");
    }

    @Test
    void parseTime_RejectsMalformedInput() {
        assertThatThrownBy(() -> DateTimeUtils.parseTime("9am")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DateTimeUtils.parseTime("24:00")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DateTimeUtils.parseTime(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void toMinutes_CountsFromMidnight() {
        assertThat(DateTimeUtils.toMinutes("00:00")).isZero();
        assertThat(DateTimeUtils.toMinutes("13:45")).isEqualTo(825);
    }
}
