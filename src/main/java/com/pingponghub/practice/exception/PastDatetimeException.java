package com.pingponghub.practice.exception;

/**
 * Exception thrown when at least one computed occurrence would start before the current moment.
 * The whole batch is rejected rather than silently dropping the past occurrences.
 */
public class PastDatetimeException extends RuntimeException {
    
    public PastDatetimeException(String message) {
        super(message);
    }
}
