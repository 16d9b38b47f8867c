package com.pingponghub.practice.exception;

/**
 * Exception thrown when the caller does not own the session or series being changed.
 */
public class UnauthorizedException extends RuntimeException {
    
    public UnauthorizedException(String message) {
        super(message);
    }
}
