package com.health.insights.engine;

/**
 * The series source could not be read. Fatal to a detection run.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
