package com.di.fleetnova.exception;

/**
 * Thrown by the data source when a resource could not be fetched after its own
 * retry policy gave up. Not retried by the pipeline.
 */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
