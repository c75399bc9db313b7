package com.di.fleetnova.exception;

/**
 * The direct pivot could not place a value into a unique (row key, column) cell.
 * Triggers the join-based fallback of the pivot shaper.
 */
public class PivotCollisionException extends RuntimeException {

    public PivotCollisionException(String message) {
        super(message);
    }
}
