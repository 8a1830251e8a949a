package com.meetadrive.app.exceptions;

/**
 * Thrown when a persisted record exists but cannot be turned back
 * into a document (malformed JSON, no sheets, ...).
 */
public class CorruptRecordException extends RuntimeException {
    public CorruptRecordException(String message) {
        super(message);
    }

    public CorruptRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
