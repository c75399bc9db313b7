package com.di.fleetnova.exception;

/**
 * Writing an artifact to the storage backend failed.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
