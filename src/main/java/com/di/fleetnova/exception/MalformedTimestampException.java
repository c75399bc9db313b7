package com.di.fleetnova.exception;

/**
 * A signal timestamp could not be parsed as a point in time.
 */
public class MalformedTimestampException extends RuntimeException {

    private final String rawValue;

    public MalformedTimestampException(String rawValue, Throwable cause) {
        super("Unparseable timestamp: '" + rawValue + "'", cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
