package com.di.fleetnova.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Counters and timers for pipeline runs: per-vessel outcomes, flattened rows,
 * gaps, summary size, pivot fallbacks and run duration.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final Counter vesselSuccessCounter;
    private final Counter vesselFailureCounter;
    private final Counter rowsFlattenedCounter;
    private final Counter nullObservationCounter;
    private final Counter gapIntervalCounter;
    private final Counter pivotFallbackCounter;
    private final Counter runAbortedCounter;
    private final DistributionSummary publishedSummarySize;
    private final Timer runTimer;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.vesselSuccessCounter = Counter.builder("fleetnova.vessel.processed")
                .description("Vessels processed per stage")
                .tag("status", "success")
                .register(meterRegistry);

        this.vesselFailureCounter = Counter.builder("fleetnova.vessel.processed")
                .description("Vessels whose processing failed and contributed an empty result")
                .tag("status", "error")
                .register(meterRegistry);

        this.rowsFlattenedCounter = Counter.builder("fleetnova.rows.flattened")
                .description("Observations with a value produced by flattening")
                .baseUnit("rows")
                .register(meterRegistry);

        this.nullObservationCounter = Counter.builder("fleetnova.rows.null")
                .description("Observations whose value was null")
                .baseUnit("rows")
                .register(meterRegistry);

        this.gapIntervalCounter = Counter.builder("fleetnova.gaps.intervals")
                .description("Gap intervals detected")
                .register(meterRegistry);

        this.pivotFallbackCounter = Counter.builder("fleetnova.pivot.fallback")
                .description("Pivots that needed the join-based fallback")
                .register(meterRegistry);

        this.runAbortedCounter = Counter.builder("fleetnova.run.aborted")
                .description("Runs aborted before publishing")
                .register(meterRegistry);

        this.publishedSummarySize = DistributionSummary.builder("fleetnova.summary.published")
                .description("Rows in the published summary per run")
                .baseUnit("rows")
                .register(meterRegistry);

        this.runTimer = Timer.builder("fleetnova.run.duration")
                .description("Wall-clock duration of a pipeline run")
                .register(meterRegistry);
    }

    public void recordVesselSuccess() {
        vesselSuccessCounter.increment();
    }

    public void recordVesselFailure() {
        vesselFailureCounter.increment();
    }

    public void recordFlattened(int cleanRows, int nullRows) {
        rowsFlattenedCounter.increment(cleanRows);
        nullObservationCounter.increment(nullRows);
    }

    public void recordGaps(int intervals) {
        gapIntervalCounter.increment(intervals);
    }

    public void recordPivot(boolean fallbackUsed) {
        if (fallbackUsed) {
            pivotFallbackCounter.increment();
        }
    }

    public void recordPublished(int rows) {
        publishedSummarySize.record(rows);
    }

    public void recordRunAborted() {
        runAbortedCounter.increment();
    }

    public void recordRun(long durationMs) {
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded run duration: {}ms", durationMs);
    }
}
