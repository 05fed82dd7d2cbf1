package com.example.AusFin.exception;

/**
 * The knowledge index (or the embedding call in front of it) could not be reached.
 * An empty result set is NOT this error.
 */
public class IndexUnavailableException extends RuntimeException {

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
