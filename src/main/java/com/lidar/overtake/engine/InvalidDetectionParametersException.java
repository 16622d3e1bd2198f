package com.lidar.overtake.engine;

/**
 * Raised once, at pipeline entry, when a parameter or the sample sequence
 * violates its precondition.
 */
public class InvalidDetectionParametersException extends RuntimeException {

    private final String field;

    public InvalidDetectionParametersException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
