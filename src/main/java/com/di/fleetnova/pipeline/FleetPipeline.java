package com.di.fleetnova.pipeline;

import com.di.fleetnova.config.FleetPipelineProperties;
import com.di.fleetnova.exception.FetchException;
import com.di.fleetnova.exception.PersistenceException;
import com.di.fleetnova.exception.RunAbortedException;
import com.di.fleetnova.exception.SchemaException;
import com.di.fleetnova.metrics.PipelineMetrics;
import com.di.fleetnova.model.FleetTables;
import com.di.fleetnova.model.GapInterval;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.PivotResult;
import com.di.fleetnova.model.SignalMetadata;
import com.di.fleetnova.model.SignalRecord;
import com.di.fleetnova.retention.RetentionOutcome;
import com.di.fleetnova.retention.RetentionStateRepository;
import com.di.fleetnova.retention.RetentionWindow;
import com.di.fleetnova.retention.RetentionWindowAggregator;
import com.di.fleetnova.sink.WideTableSink;
import com.di.fleetnova.source.FleetDataSource;
import com.di.fleetnova.source.ResourceKind;
import com.di.fleetnova.storage.LocalFileStore;
import com.di.fleetnova.storage.PartitionPaths;
import com.di.fleetnova.storage.RetentionCleaner;
import com.di.fleetnova.transform.FleetFlattener;
import com.di.fleetnova.transform.MetadataEnricher;
import com.di.fleetnova.transform.PivotShaper;
import com.di.fleetnova.util.MdcPropagation;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one pipeline run.
 *
 * <pre>
 * fleet       fetch fleet → active vessel ids + ship tables → latest/imos
 * signals     per vessel: fetch + flatten → catalog merge → latest/signal_mapping
 * timeseries  per vessel: fetch + flatten + enrich + gaps
 *             → retention window → pivot → sink → daily summary
 * cleanup     purge old raw / transformed / gaps partitions
 * </pre>
 *
 * Per-vessel failures are contained by {@link VesselBatchExecutor}. Run-level failures
 * (no vessel list, no catalog, sink unreachable) raise {@link RunAbortedException} before
 * the summary is published.
 */
@Slf4j
@RequiredArgsConstructor
public class FleetPipeline {

    static final String IMOS_TABLE      = "imos";
    static final String CATALOG_TABLE   = "signal_mapping";
    static final String SHIP_TABLE      = "ShipData";
    static final String SUMMARY_TABLE   = "Summary";

    private final FleetPipelineProperties props;
    private final FleetDataSource dataSource;
    private final LocalFileStore store;
    private final PartitionPaths paths;
    private final FleetFlattener fleetFlattener;
    private final VesselProcessor processor;
    private final VesselBatchExecutor executor;
    private final RetentionStateRepository retentionRepository;
    private final RetentionWindowAggregator aggregator;
    private final PivotShaper pivotShaper;
    private final WideTableSink sink;
    private final TimeseriesPivotExporter exporter;
    private final RetentionCleaner cleaner;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public RunReport run(PipelineMode mode) {
        RunContext run = RunContext.startingAt(LocalDateTime.now(clock));
        long startMs = System.currentTimeMillis();
        RunReport.RunReportBuilder report = RunReport.builder().mode(mode).runPartition(run.runPartition());
        AtomicInteger failures = new AtomicInteger();

        Map<String, String> previous = MdcPropagation.copyMdc();
        MDC.put(MdcPropagation.RUN_KEY, run.runPartition());
        log.info("[RUN] ========== START mode={} partition={} ==========", mode, run.runPartition());
        try {
            switch (mode) {
                case PIVOT_EXPORT -> {
                    PivotResult pivot = exporter.export();
                    report.pivotRows(pivot.getTable().rows().size())
                            .pivotColumns(pivot.getTable().signalColumns().size())
                            .pivotFallbackUsed(pivot.isFallbackUsed());
                }
                case FLEET -> {
                    List<String> vessels = runFleet(run);
                    report.vessels(vessels.size());
                    List<SignalMetadata> catalog = runSignals(run, vessels, failures);
                    report.signalCatalogSize(catalog.size());
                }
                case ALL -> {
                    List<String> vessels = runFleet(run);
                    report.vessels(vessels.size());
                    List<SignalMetadata> catalog = runSignals(run, vessels, failures);
                    report.signalCatalogSize(catalog.size());
                    runTimeseries(run, vessels, catalog, failures, report);
                }
                case TIMESERIES -> {
                    List<String> vessels = loadVesselIds();
                    List<SignalMetadata> catalog = loadCatalog();
                    report.vessels(vessels.size()).signalCatalogSize(catalog.size());
                    runTimeseries(run, vessels, catalog, failures, report);
                }
            }
        } catch (RunAbortedException e) {
            metrics.recordRunAborted();
            log.error("[RUN] ABORTED mode={} partition={}: {}", mode, run.runPartition(), e.getMessage());
            throw e;
        } finally {
            cleanup(run);
            long durationMs = System.currentTimeMillis() - startMs;
            metrics.recordRun(durationMs);
            report.durationMs(durationMs).failedVessels(failures.get());
            MDC.remove(MdcPropagation.RUN_KEY);
            if (previous.containsKey(MdcPropagation.RUN_KEY)) {
                MDC.put(MdcPropagation.RUN_KEY, previous.get(MdcPropagation.RUN_KEY));
            }
        }

        RunReport result = report.build();
        log.info("[RUN] ========== DONE {} ==========", result);
        return result;
    }

    // ------------------------------------------------------------------ //
    // Stages                                                              //
    // ------------------------------------------------------------------ //

    List<String> runFleet(RunContext run) {
        JsonNode fleet;
        try {
            fleet = dataSource.fetch(null, ResourceKind.FLEET);
        } catch (FetchException e) {
            throw new RunAbortedException("Vessel list unavailable: " + e.getMessage(), e);
        }
        store.writeRaw(fleet, ResourceKind.FLEET.artifactName(null), paths.raw(run.runPartition()));

        List<String> vessels;
        FleetTables tables;
        try {
            vessels = fleetFlattener.activeVesselIds(fleet);
            tables = fleetFlattener.flattenFleet(fleet, run.loadDate());
        } catch (SchemaException e) {
            throw new RunAbortedException("Vessel list unusable: " + e.getMessage(), e);
        }

        store.writeTable(tables.ships(), SHIP_TABLE, paths.transformed(run.runPartition()));
        tables.nested().forEach((field, rows) ->
                store.writeTable(rows, SHIP_TABLE + "_" + field, paths.transformed(run.runPartition())));

        List<Map<String, Object>> imoRows = new ArrayList<>(vessels.size());
        for (String imo : vessels) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(FleetFlattener.IMO_COLUMN, imo);
            imoRows.add(row);
        }
        store.writeTable(imoRows, IMOS_TABLE, paths.latest());
        log.info("[FLEET] {} ship(s), {} active, {} child table(s)",
                tables.ships().size(), vessels.size(), tables.nested().size());
        return vessels;
    }

    List<SignalMetadata> runSignals(RunContext run, List<String> vessels, AtomicInteger failures) {
        List<SignalMetadata> existing = store.readTable(CATALOG_TABLE, paths.latest(), SignalMetadata.class);
        AtomicReference<List<SignalMetadata>> catalog = new AtomicReference<>(existing);

        int failed = executor.execute("SIGNALS", vessels,
                vessel -> processor.processSignals(run, vessel),
                vessel -> List.<SignalRecord>of(),
                batch -> {
                    List<SignalMetadata> incoming = new ArrayList<>();
                    for (List<SignalRecord> records : batch) {
                        records.forEach(r -> incoming.add(SignalMetadata.fromRecord(r)));
                    }
                    catalog.set(MetadataEnricher.mergeCatalog(catalog.get(), incoming));
                });
        failures.addAndGet(failed);

        List<SignalMetadata> result = catalog.get();
        store.writeTable(result, CATALOG_TABLE, paths.latest());
        log.info("[SIGNALS] catalog {} → {} entries", existing.size(), result.size());
        return result;
    }

    void runTimeseries(RunContext run, List<String> vessels, List<SignalMetadata> catalog,
                       AtomicInteger failures, RunReport.RunReportBuilder report) {
        List<Observation> current = new ArrayList<>();
        List<GapInterval> gaps = new ArrayList<>();

        int failed = executor.execute("TIMESERIES", vessels,
                vessel -> processor.processTimeseries(run, vessel, catalog),
                VesselTimeseries::empty,
                batch -> batch.forEach(r -> {
                    current.addAll(r.observations());
                    gaps.addAll(r.gaps());
                }));
        failures.addAndGet(failed);
        report.observations(current.size()).gapIntervals(gaps.size());

        try {
            sink.verifyConnection();
        } catch (PersistenceException e) {
            throw new RunAbortedException("Sink unavailable: " + e.getMessage(), e);
        }

        RetentionWindow window = retentionRepository.load(run.runDate());
        RetentionOutcome outcome = aggregator.aggregate(window, current, run.runDate());
        metrics.recordPublished(outcome.getPublished().size());

        PivotResult pivot;
        try {
            pivot = pivotShaper.pivot(outcome.getPublished(), sink.existingSignalColumns());
            metrics.recordPivot(pivot.isFallbackUsed());
            sink.write(pivot, gaps);
        } catch (PersistenceException e) {
            throw new RunAbortedException("Sink write failed: " + e.getMessage(), e);
        }

        store.writeTable(outcome.getPublished(), SUMMARY_TABLE, paths.transformed(run.runPartition()));
        retentionRepository.save(outcome, run.runDate());

        report.publishedRows(outcome.getPublished().size())
                .pivotRows(pivot.getTable().rows().size())
                .pivotColumns(pivot.getTable().signalColumns().size())
                .pivotFallbackUsed(pivot.isFallbackUsed());
        log.info("[TIMESERIES] observations={} gaps={} published={} pivotRows={}",
                current.size(), gaps.size(), outcome.getPublished().size(), pivot.getTable().rows().size());
    }

    List<String> loadVesselIds() {
        if (!store.tableExists(IMOS_TABLE, paths.latest())) {
            throw new RunAbortedException("No persisted vessel list under " + paths.latest()
                    + "; run mode 'fleet' or 'all' first");
        }
        List<String> ids = new ArrayList<>();
        for (Map<String, Object> row : store.readRows(IMOS_TABLE, paths.latest())) {
            Object imo = row.get(FleetFlattener.IMO_COLUMN);
            if (imo != null) {
                ids.add(String.valueOf(imo));
            }
        }
        return ids;
    }

    List<SignalMetadata> loadCatalog() {
        if (!store.tableExists(CATALOG_TABLE, paths.latest())) {
            throw new RunAbortedException("No persisted signal catalog under " + paths.latest()
                    + "; run mode 'fleet' or 'all' first");
        }
        return store.readTable(CATALOG_TABLE, paths.latest(), SignalMetadata.class);
    }

    private void cleanup(RunContext run) {
        int days = props.getDaysToKeep();
        cleaner.cleanup(paths.rawRoot(), run.runDate(), days);
        cleaner.cleanup(paths.transformedRoot(), run.runDate(), days);
        cleaner.cleanup(paths.gapsRoot(), run.runDate(), days);
    }
}
