package com.di.fleetnova.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of the pivot step.
 */
@Value
@Builder
public class PivotResult {

    WideTable    table;
    SchemaDelta  schemaDelta;

    /** Signals left out by the column cap, most frequent first. */
    List<String> droppedSignals;

    /** {@code true} when the join-based fallback produced {@link #table}. */
    boolean      fallbackUsed;

    public static PivotResult empty() {
        return PivotResult.builder()
                .table(WideTable.empty())
                .schemaDelta(SchemaDelta.none())
                .droppedSignals(List.of())
                .fallbackUsed(false)
                .build();
    }
}
