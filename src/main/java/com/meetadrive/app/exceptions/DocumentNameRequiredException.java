package com.meetadrive.app.exceptions;

/**
 * Thrown when saving a document that has never been saved
 * without giving it a name.
 */
public class DocumentNameRequiredException extends RuntimeException {
    public DocumentNameRequiredException(String message) {
        super(message);
    }
}
