package com.example.AusFin.exception;

/**
 * Malformed rule table or benchmark file. Thrown while the application context is
 * built, so a partially loaded configuration never serves requests.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
