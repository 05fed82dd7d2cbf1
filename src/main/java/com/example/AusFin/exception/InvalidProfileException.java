package com.example.AusFin.exception;

/**
 * Raised when a {@code UserProfile} (or a calculation argument derived from the caller)
 * is malformed or out of range. Always surfaced to the caller, never coerced.
 */
public class InvalidProfileException extends RuntimeException {

    public InvalidProfileException(String message) {
        super(message);
    }
}
