package com.di.fleetnova.model;

import java.util.List;

/**
 * Output of flattening a timeseries payload: observations with a value and
 * observations whose value was {@code null}. Both lists are always non-null.
 */
public record FlattenedTimeseries(List<Observation> clean, List<Observation> nulls) {

    public FlattenedTimeseries {
        clean = clean != null ? List.copyOf(clean) : List.of();
        nulls = nulls != null ? List.copyOf(nulls) : List.of();
    }

    public static FlattenedTimeseries empty() {
        return new FlattenedTimeseries(List.of(), List.of());
    }

    public boolean isEmpty() {
        return clean.isEmpty() && nulls.isEmpty();
    }
}
