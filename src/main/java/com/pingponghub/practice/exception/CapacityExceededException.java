package com.pingponghub.practice.exception;

/**
 * Exception thrown when a member tries to join a practice that is already full.
 *
 * This is a 409 Conflict error indicating the resource state prevents the operation.
 */
public class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(String message) {
        super(message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
