package com.meetadrive.app.exceptions;

/**
 * Thrown when reading or writing a persisted record fails at the I/O level.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
