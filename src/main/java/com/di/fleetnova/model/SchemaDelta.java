package com.di.fleetnova.model;

import java.util.List;

/**
 * Signal columns a persistent wide table has to gain before a pivot result can be
 * merged into it.
 */
public record SchemaDelta(List<String> newColumns) {

    public SchemaDelta {
        newColumns = newColumns != null ? List.copyOf(newColumns) : List.of();
    }

    public static SchemaDelta none() {
        return new SchemaDelta(List.of());
    }

    public boolean isEmpty() {
        return newColumns.isEmpty();
    }
}
