package com.pingponghub.practice.exception;

/**
 * Exception thrown when a member joins a practice they are already signed up for.
 */
public class AlreadySignedUpException extends RuntimeException {

    public AlreadySignedUpException(String message) {
        super(message);
    }
}
