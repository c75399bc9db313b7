package com.di.fleetnova.model;

/**
 * Structural variant of a raw per-vessel payload, decided once when the payload
 * is inspected.
 */
public enum PayloadShape {

    /** Missing, {@code null} or an object/array without entries. */
    EMPTY,
    /** {@code {"detail": "..."}}: the data source reported a failure. */
    ERROR,
    /** signal id → { timestamp → scalar | null } ("timeseries"). */
    NESTED_SERIES,
    /** {@code {"imo": ..., "signals": { signal id → structured value }}} ("signals"). */
    SCALAR,
    /** Anything else. */
    UNKNOWN
}
