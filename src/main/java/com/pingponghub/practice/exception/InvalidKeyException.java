package com.pingponghub.practice.exception;

/**
 * Exception thrown when a DynamoDB key cannot be built from the given identifier.
 */
public class InvalidKeyException extends RuntimeException {
    
    public InvalidKeyException(String message) {
        super(message);
    }
    
    public InvalidKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
