package com.pingponghub.practice.exception;

/**
 * Exception thrown when a recurrence end date lies beyond December 31st of the current year.
 */
public class PolicyCapExceededException extends ValidationException {
    
    public PolicyCapExceededException(String message) {
        super(message);
    }
}
