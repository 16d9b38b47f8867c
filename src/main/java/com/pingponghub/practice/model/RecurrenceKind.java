package com.pingponghub.practice.model;

/**
 * The recurrence patterns a practice series can follow.
 */
public enum RecurrenceKind {
    /** Same weekday every week. */
    WEEKLY,
    /** Same day of month, clamped to the last day in shorter months. */
    MONTHLY_FIXED_DATE,
    /** The nth occurrence of a weekday in each month, e.g. "2nd Tuesday". */
    MONTHLY_NTH_WEEKDAY
}
