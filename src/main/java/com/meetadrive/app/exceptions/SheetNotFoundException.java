package com.meetadrive.app.exceptions;

/**
 * Thrown when an operation names a sheet ID
 * that doesn't exist in the document.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
