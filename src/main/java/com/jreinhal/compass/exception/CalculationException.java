package com.jreinhal.compass.exception;

/**
 * A calculation could not be evaluated because a required input was missing or not numeric.
 */
public class CalculationException extends RuntimeException {
    private final String field;

    public CalculationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return this.field;
    }
}
