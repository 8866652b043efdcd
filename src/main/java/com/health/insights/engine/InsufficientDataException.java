package com.health.insights.engine;

/**
 * Raised when a detector or estimator declines because the data cannot support a
 * result. Callers treat it as a decline, not as a failure.
 */
public class InsufficientDataException extends RuntimeException {

    private final int required;
    private final int available;

    public InsufficientDataException(String message, int required, int available) {
        super(message);
        this.required = required;
        this.available = available;
    }

    public InsufficientDataException(String message) {
        this(message, 0, 0);
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
