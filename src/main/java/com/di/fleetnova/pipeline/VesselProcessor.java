package com.di.fleetnova.pipeline;

import com.di.fleetnova.exception.SchemaException;
import com.di.fleetnova.metrics.PipelineMetrics;
import com.di.fleetnova.model.FlattenedTimeseries;
import com.di.fleetnova.model.GapInterval;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.RawPayload;
import com.di.fleetnova.model.SignalMetadata;
import com.di.fleetnova.model.SignalRecord;
import com.di.fleetnova.source.FleetDataSource;
import com.di.fleetnova.source.ResourceKind;
import com.di.fleetnova.storage.LocalFileStore;
import com.di.fleetnova.storage.PartitionPaths;
import com.di.fleetnova.transform.GapDetector;
import com.di.fleetnova.transform.MetadataEnricher;
import com.di.fleetnova.transform.SignalFlattener;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;

/**
 * Fetch, snapshot, flatten, enrich and gap-detect for a single vessel. Runs on pool
 * workers; touches no shared mutable state.
 */
@Slf4j
@RequiredArgsConstructor
public class VesselProcessor {

    static final String GAPS_PREFIX = "Gaps_";

    private final FleetDataSource dataSource;
    private final LocalFileStore store;
    private final PartitionPaths paths;
    private final SignalFlattener flattener;
    private final MetadataEnricher enricher;
    private final GapDetector gapDetector;
    private final PipelineMetrics metrics;

    /** Signal definitions of one vessel; an unexpected payload shape yields an empty list. */
    public List<SignalRecord> processSignals(RunContext run, String vesselId) {
        String name = ResourceKind.SIGNALS.artifactName(vesselId);
        JsonNode payload = dataSource.fetch(vesselId, ResourceKind.SIGNALS);
        store.writeRaw(payload, name, paths.raw(run.runPartition()));

        List<SignalRecord> records;
        try {
            records = flattener.flattenSignals(vesselId, RawPayload.of(payload), run.loadDate());
        } catch (SchemaException e) {
            log.warn("[SIGNALS] vessel={} {}", vesselId, e.getMessage());
            return List.of();
        }
        if (!records.isEmpty()) {
            store.writeTable(records, name, paths.transformed(run.runPartition()));
        }
        log.debug("[SIGNALS] vessel={} signals={}", vesselId, records.size());
        return records;
    }

    /** Enriched observations and gap intervals of one vessel. */
    public VesselTimeseries processTimeseries(RunContext run, String vesselId, Collection<SignalMetadata> catalog) {
        String name = ResourceKind.TIMESERIES.artifactName(vesselId);
        JsonNode payload = dataSource.fetch(vesselId, ResourceKind.TIMESERIES);
        store.writeRaw(payload, name, paths.raw(run.runPartition()));

        FlattenedTimeseries flat;
        try {
            flat = flattener.flattenTimeseries(vesselId, RawPayload.of(payload), run.loadDate());
        } catch (SchemaException e) {
            log.warn("[TIMESERIES] vessel={} {}", vesselId, e.getMessage());
            return VesselTimeseries.empty(vesselId);
        }
        metrics.recordFlattened(flat.clean().size(), flat.nulls().size());

        List<Observation> enriched = enricher.enrich(flat.clean(), catalog);
        List<GapInterval> gaps = gapDetector.detect(flat.nulls());
        metrics.recordGaps(gaps.size());

        if (!enriched.isEmpty()) {
            store.writeTable(enriched, name, paths.transformed(run.runPartition()));
        }
        if (!gaps.isEmpty()) {
            store.writeTable(gaps, GAPS_PREFIX + vesselId, paths.gaps(run.runPartition()));
        }
        log.info("[TIMESERIES] vessel={} observations={} nulls={} gaps={}",
                vesselId, enriched.size(), flat.nulls().size(), gaps.size());
        return new VesselTimeseries(vesselId, enriched, gaps);
    }
}
