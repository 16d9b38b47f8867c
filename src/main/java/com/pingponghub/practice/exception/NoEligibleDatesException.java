package com.pingponghub.practice.exception;

/**
 * Exception thrown when a recurrence pattern produces no qualifying date in range.
 * For example a 5th-weekday series whose end date comes before the next 5th occurrence.
 */
public class NoEligibleDatesException extends RuntimeException {
    
    public NoEligibleDatesException(String message) {
        super(message);
    }
}
