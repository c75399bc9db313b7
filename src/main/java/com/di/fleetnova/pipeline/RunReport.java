package com.di.fleetnova.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of one pipeline run, logged at the end and returned to the caller.
 */
@Value
@Builder
public class RunReport {

    PipelineMode mode;
    String       runPartition;
    int          vessels;
    int          failedVessels;
    int          signalCatalogSize;
    int          observations;
    int          gapIntervals;
    int          publishedRows;
    int          pivotRows;
    int          pivotColumns;
    boolean      pivotFallbackUsed;
    long         durationMs;
}
