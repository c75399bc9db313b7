package com.di.fleetnova.pipeline;

import com.di.fleetnova.config.FleetPipelineProperties;
import com.di.fleetnova.exception.PersistenceException;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.PivotResult;
import com.di.fleetnova.model.WideRow;
import com.di.fleetnova.model.WideTable;
import com.di.fleetnova.source.ResourceKind;
import com.di.fleetnova.storage.LocalFileStore;
import com.di.fleetnova.storage.PartitionPaths;
import com.di.fleetnova.transform.PivotShaper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Builds one wide table from the stored per-vessel timeseries tables.
 *
 * <p>Day partitions are visited newest first; of each day only the latest run that
 * holds timeseries tables is used, up to {@code pivot-export.max-days} days. Null
 * values are dropped and duplicates of (vessel, signal, timestamp) resolve to the row
 * with the latest load date.
 */
@Slf4j
public class TimeseriesPivotExporter {

    static final String TABLE_PREFIX = ResourceKind.TIMESERIES.artifactName("");

    private final LocalFileStore store;
    private final PartitionPaths paths;
    private final PivotShaper shaper;
    private final FleetPipelineProperties props;

    public TimeseriesPivotExporter(LocalFileStore store, PartitionPaths paths, PivotShaper shaper,
                                   FleetPipelineProperties props) {
        this.store = store;
        this.paths = paths;
        this.shaper = shaper;
        this.props = props;
    }

    public PivotResult export() {
        List<Path> runs = latestRunPerDay(paths.transformedRoot(), props.getPivotExport().getMaxDays());
        if (runs.isEmpty()) {
            log.warn("[PIVOT] No timeseries tables found under {}", paths.transformedRoot());
            return PivotResult.empty();
        }

        List<Observation> combined = new ArrayList<>();
        for (Path run : runs) {
            for (String table : store.listTables(run, TABLE_PREFIX)) {
                combined.addAll(store.readTable(table, run, Observation.class));
            }
        }
        List<Observation> latest = dedupLatest(combined);
        log.info("[PIVOT] {} run(s), {} row(s) read, {} after null removal and dedup",
                runs.size(), combined.size(), latest.size());

        PivotResult result = shaper.pivot(latest);
        Path output = Paths.get(props.getPivotExport().getOutput());
        store.writeTableTo(toRows(result.getTable()), output);
        logStatistics(result.getTable(), output);
        return result;
    }

    /**
     * Newest-first run directories ({@code YYYY/MM/DD/HH/mm}), one per day, each the
     * latest run of its day that contains timeseries tables.
     */
    List<Path> latestRunPerDay(Path root, Integer maxDays) {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return out;
        }
        try {
            for (Path year : subdirsDesc(root)) {
                for (Path month : subdirsDesc(year)) {
                    for (Path day : subdirsDesc(month)) {
                        if (maxDays != null && out.size() >= maxDays) {
                            return out;
                        }
                        latestRunOf(day).ifPresent(out::add);
                    }
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to scan " + root, e);
        }
        return out;
    }

    private Optional<Path> latestRunOf(Path day) throws IOException {
        for (Path hour : subdirsDesc(day)) {
            for (Path minute : subdirsDesc(hour)) {
                if (!store.listTables(minute, TABLE_PREFIX).isEmpty()) {
                    return Optional.of(minute);
                }
            }
        }
        return Optional.empty();
    }

    /** Drops null values; keeps the row with the latest load date per (vessel, signal, timestamp). */
    static List<Observation> dedupLatest(List<Observation> rows) {
        Map<List<String>, Observation> latest = new LinkedHashMap<>();
        for (Observation obs : rows) {
            if (obs.getValue() == null) continue;
            List<String> key = List.of(String.valueOf(obs.getVesselId()), String.valueOf(obs.getSignalId()),
                    String.valueOf(obs.getTimestamp()));
            latest.merge(key, obs, (a, b) -> isLater(b, a) ? b : a);
        }
        return new ArrayList<>(latest.values());
    }

    private static boolean isLater(Observation candidate, Observation current) {
        if (candidate.getLoadDate() == null) return false;
        return current.getLoadDate() == null || candidate.getLoadDate().isAfter(current.getLoadDate());
    }

    static List<Map<String, Object>> toRows(WideTable table) {
        List<Map<String, Object>> rows = new ArrayList<>(table.rows().size());
        for (WideRow row : table.rows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(WideTable.KEY_COLUMNS.get(0), row.getVesselId());
            out.put(WideTable.KEY_COLUMNS.get(1), row.getTimestamp());
            out.put(WideTable.KEY_COLUMNS.get(2), row.getLoadDate());
            for (String column : table.signalColumns()) {
                out.put(column, row.value(column));
            }
            rows.add(out);
        }
        return rows;
    }

    private static void logStatistics(WideTable table, Path output) {
        if (table.isEmpty()) {
            log.info("[PIVOT] Wrote empty table to {}", output);
            return;
        }
        Set<String> vessels = new TreeSet<>();
        String first = null;
        String last = null;
        for (WideRow row : table.rows()) {
            vessels.add(row.getVesselId());
            if (first == null || row.getTimestamp().compareTo(first) < 0) first = row.getTimestamp();
            if (last == null || row.getTimestamp().compareTo(last) > 0) last = row.getTimestamp();
        }
        log.info("[PIVOT] Wrote {} row(s) x {} signal column(s) for {} vessel(s), {} .. {} to {}",
                table.rows().size(), table.signalColumns().size(), vessels.size(), first, last, output);
    }

    private static List<Path> subdirsDesc(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isDirectory)
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        }
    }
}
