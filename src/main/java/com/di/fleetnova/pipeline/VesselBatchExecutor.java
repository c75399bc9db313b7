package com.di.fleetnova.pipeline;

import com.di.fleetnova.metrics.PipelineMetrics;
import com.di.fleetnova.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs a per-vessel task on a fixed worker pool, batch by batch.
 *
 * <p>Within a batch every vessel is an independent future; a failing vessel is logged,
 * counted and replaced by its empty result, so siblings keep running. After all futures
 * of a batch completed, the collected results are handed to the reducer on the calling
 * thread, in vessel order, before the next batch is submitted.
 */
@Slf4j
public class VesselBatchExecutor {

    private final int batchSize;
    private final int maxWorkers;
    private final PipelineMetrics metrics;

    public VesselBatchExecutor(int batchSize, int maxWorkers, PipelineMetrics metrics) {
        if (batchSize < 1 || maxWorkers < 1) {
            throw new IllegalArgumentException("batchSize and maxWorkers must be >= 1");
        }
        this.batchSize = batchSize;
        this.maxWorkers = maxWorkers;
        this.metrics = metrics;
    }

    /**
     * @param stage     log prefix, e.g. {@code TIMESERIES}
     * @param task      work for one vessel; may throw
     * @param onFailure empty result contributed by a failed vessel
     * @param reducer   receives each batch's results on the calling thread
     * @return number of vessels whose task failed
     */
    public <R> int execute(String stage, List<String> vesselIds, Function<String, R> task,
                           Function<String, R> onFailure, Consumer<List<R>> reducer) {
        if (vesselIds.isEmpty()) {
            log.info("[{}] No vessels to process", stage);
            return 0;
        }
        int workers = Math.min(maxWorkers, vesselIds.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        AtomicInteger failed = new AtomicInteger();
        int batches = (vesselIds.size() + batchSize - 1) / batchSize;
        try {
            for (int b = 0; b < batches; b++) {
                List<String> batch = vesselIds.subList(b * batchSize, Math.min((b + 1) * batchSize, vesselIds.size()));
                log.info("[{}] Batch {}/{}: {} vessel(s) on {} worker(s)", stage, b + 1, batches, batch.size(), workers);

                List<CompletableFuture<R>> futures = new ArrayList<>(batch.size());
                for (String vesselId : batch) {
                    CompletableFuture<R> f = CompletableFuture
                            .supplyAsync(MdcPropagation.wrapSupplier(MdcPropagation.VESSEL_KEY, vesselId,
                                    () -> task.apply(vesselId)), executor)
                            .thenApply(result -> {
                                metrics.recordVesselSuccess();
                                return result;
                            })
                            .exceptionally(ex -> {
                                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                                failed.incrementAndGet();
                                metrics.recordVesselFailure();
                                log.error("[{}] vessel={} FAILED: {}", stage, vesselId, cause.getMessage(), cause);
                                return onFailure.apply(vesselId);
                            });
                    futures.add(f);
                }

                CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

                List<R> results = new ArrayList<>(futures.size());
                for (CompletableFuture<R> f : futures) {
                    results.add(f.join());
                }
                reducer.accept(results);
            }
        } finally {
            executor.shutdown();
        }
        log.info("[{}] {} vessel(s) processed, {} failed", stage, vesselIds.size(), failed.get());
        return failed.get();
    }
}
