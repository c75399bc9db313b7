package com.di.fleetnova.exception;

/**
 * A run-level precondition failed (no vessel list, sink unavailable, ...).
 * The run stops before any summary is published.
 */
public class RunAbortedException extends RuntimeException {

    public RunAbortedException(String message) {
        super(message);
    }

    public RunAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
