package com.meetadrive.app.exceptions;

/**
 * Thrown when a request names an editing session that was never opened
 * or has already been closed.
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String message) {
        super(message);
    }
}
