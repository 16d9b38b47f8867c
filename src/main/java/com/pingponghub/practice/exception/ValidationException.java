package com.pingponghub.practice.exception;

/**
 * Exception thrown when a submitted field is missing or malformed.
 * The caller is expected to correct the input and resubmit; nothing has been written.
 */
public class ValidationException extends RuntimeException {
    
    public ValidationException(String message) {
        super(message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
