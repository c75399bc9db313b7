package com.di.fleetnova.retention;

import com.di.fleetnova.model.Observation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one retention-window aggregation.
 */
@Value
@Builder(toBuilder = true)
public class RetentionOutcome {

    DayState          state;

    /** Historical partition after folding and pruning. */
    List<Observation> hist;

    /** Rows tagged {@code new} or {@code today}: the run's summary. */
    List<Observation> published;

    int               foldedRows;
    int               prunedRows;

    /** Whether {@link #hist} differs from the loaded partition and must be written back. */
    public boolean isHistChanged() {
        return state == DayState.NEW_DAY || prunedRows > 0;
    }
}
