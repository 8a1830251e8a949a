package com.meetadrive.app.exceptions;

/**
 * Thrown when loading a document ID that has no persisted record.
 */
public class DocumentNotFoundException extends RuntimeException {
    public DocumentNotFoundException(String message) {
        super(message);
    }
}
