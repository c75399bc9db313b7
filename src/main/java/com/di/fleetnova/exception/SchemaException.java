package com.di.fleetnova.exception;

import com.di.fleetnova.model.PayloadShape;

/**
 * A payload is an error payload or does not have the structure the caller expects.
 * Callers short-circuit to an empty result.
 */
public class SchemaException extends RuntimeException {

    private final PayloadShape shape;

    public SchemaException(String message, PayloadShape shape) {
        super(message);
        this.shape = shape;
    }

    public PayloadShape getShape() {
        return shape;
    }
}
