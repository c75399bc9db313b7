package com.di.fleetnova.sink;

import com.di.fleetnova.model.GapInterval;
import com.di.fleetnova.model.PivotResult;

import java.util.List;
import java.util.Set;

/**
 * Relational destination for the pivoted summary and the gap intervals.
 */
public interface WideTableSink {

    /** Fails with {@link com.di.fleetnova.exception.PersistenceException} when the sink cannot be reached. */
    void verifyConnection();

    /** Signal columns the persistent wide table already has. */
    Set<String> existingSignalColumns();

    /**
     * Extends the schema by {@link PivotResult#getSchemaDelta()}, then merges the wide rows
     * and upserts the gaps.
     */
    void write(PivotResult pivot, List<GapInterval> gaps);
}
