package com.meetadrive.app.exceptions;

/**
 * Thrown when a cell reference does not have the letters-then-digits shape
 * (e.g. "a1", "A0", "1A") or a column label contains anything but A-Z.
 */
public class AddressParseException extends RuntimeException {
    public AddressParseException(String message) {
        super(message);
    }
}
