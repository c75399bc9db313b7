package com.di.fleetnova.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings handed to the transformation components at construction time.
 *
 * @param gapMergeThreshold null samples closer than this belong to the same gap
 * @param historyDays       size of the historical dedup window
 * @param pivotMaxSignals   pivot column cap, {@code null} for none
 */
public record PipelineContext(Duration gapMergeThreshold, int historyDays, Integer pivotMaxSignals) {

    public PipelineContext {
        Objects.requireNonNull(gapMergeThreshold, "gapMergeThreshold");
        if (gapMergeThreshold.isNegative()) {
            throw new IllegalArgumentException("gapMergeThreshold must not be negative: " + gapMergeThreshold);
        }
        if (historyDays < 0) {
            throw new IllegalArgumentException("historyDays must be >= 0: " + historyDays);
        }
        if (pivotMaxSignals != null && pivotMaxSignals < 1) {
            throw new IllegalArgumentException("pivotMaxSignals must be >= 1: " + pivotMaxSignals);
        }
    }

    public static PipelineContext from(FleetPipelineProperties props) {
        return new PipelineContext(props.getGapMergeThreshold(), props.getHistoryDays(), props.getPivotMaxSignals());
    }
}
