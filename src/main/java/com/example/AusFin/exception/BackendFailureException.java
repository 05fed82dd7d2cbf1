package com.example.AusFin.exception;

/**
 * Generation backend error or timeout. Only used inside the synthesizer; callers
 * see an unanswerable answer instead.
 */
public class BackendFailureException extends RuntimeException {

    public BackendFailureException(String message) {
        super(message);
    }

    public BackendFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
