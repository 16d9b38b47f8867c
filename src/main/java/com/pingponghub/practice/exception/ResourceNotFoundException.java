package com.pingponghub.practice.exception;

/**
 * Exception thrown when a practice session or recurrence rule does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {
    
    public ResourceNotFoundException(String message) {
        super(message);
    }
}
