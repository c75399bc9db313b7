package com.di.fleetnova.transform;

import com.di.fleetnova.config.PipelineContext;
import com.di.fleetnova.exception.PivotCollisionException;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.PivotResult;
import com.di.fleetnova.model.SchemaDelta;
import com.di.fleetnova.model.WideRow;
import com.di.fleetnova.model.WideTable;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reshapes the long-form summary into a wide table keyed by (vessel, timestamp, load date)
 * with one column per signal id.
 *
 * <p>The direct reshape rejects rows it cannot key (missing key parts, signal ids that
 * clash with a key column) with {@link PivotCollisionException}; the join-based fallback
 * then skips those rows and builds the table from per-signal sub-tables.
 */
@Slf4j
public class PivotShaper {

    private static final Comparator<WideRow> ROW_ORDER = Comparator
            .comparing(WideRow::getVesselId)
            .thenComparing(WideRow::getTimestamp)
            .thenComparing(WideRow::getLoadDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Integer maxSignals;

    public PivotShaper(PipelineContext context) {
        this.maxSignals = context.pivotMaxSignals();
    }

    public PivotResult pivot(List<Observation> summary) {
        return pivot(summary, List.of());
    }

    /**
     * @param summary         long-form rows to pivot
     * @param existingColumns signal columns the persistent wide table already has
     */
    public PivotResult pivot(List<Observation> summary, Collection<String> existingColumns) {
        if (summary == null || summary.isEmpty()) {
            return PivotResult.empty();
        }

        List<String> ranked = rankSignals(summary);
        List<String> selected = maxSignals != null && ranked.size() > maxSignals
                ? ranked.subList(0, maxSignals)
                : ranked;
        List<String> dropped = ranked.subList(selected.size(), ranked.size());
        if (!dropped.isEmpty()) {
            log.warn("[PIVOT] {} distinct signals exceed cap {}; dropped: {}", ranked.size(), maxSignals, dropped);
        }
        Set<String> columns = new TreeSet<>(selected);

        WideTable table;
        boolean fallback = false;
        try {
            table = pivotDirect(summary, columns);
        } catch (PivotCollisionException e) {
            log.warn("[PIVOT] Direct reshape failed ({}); using join-based fallback", e.getMessage());
            table = pivotByJoin(summary, columns);
            fallback = true;
        }

        SchemaDelta delta = schemaDelta(table.signalColumns(), existingColumns);
        log.info("[PIVOT] rows={} columns={} newColumns={} fallback={}",
                table.rows().size(), table.signalColumns().size(), delta.newColumns().size(), fallback);
        return PivotResult.builder()
                .table(table)
                .schemaDelta(delta)
                .droppedSignals(List.copyOf(dropped))
                .fallbackUsed(fallback)
                .build();
    }

    /**
     * Signal ids ordered by occurrence count descending, ties by ascending id.
     * Rows without a signal id are not counted.
     */
    public static List<String> rankSignals(Collection<Observation> rows) {
        Map<String, Integer> counts = new HashMap<>();
        for (Observation obs : rows) {
            if (obs.getSignalId() != null) {
                counts.merge(obs.getSignalId(), 1, Integer::sum);
            }
        }
        List<String> ids = new ArrayList<>(counts.keySet());
        ids.sort(Comparator.<String>comparingInt(counts::get).reversed().thenComparing(Comparator.naturalOrder()));
        return ids;
    }

    /** Columns of {@code tableColumns} not yet present in {@code existing}, in table order. */
    public static SchemaDelta schemaDelta(List<String> tableColumns, Collection<String> existing) {
        Set<String> known = existing != null ? new HashSet<>(existing) : Set.of();
        List<String> added = new ArrayList<>();
        for (String column : tableColumns) {
            if (!known.contains(column)) {
                added.add(column);
            }
        }
        return new SchemaDelta(added);
    }

    WideTable pivotDirect(List<Observation> summary, Set<String> columns) {
        Map<RowKey, WideRow> rows = new LinkedHashMap<>();
        for (Observation obs : summary) {
            String problem = keyProblem(obs);
            if (problem != null) {
                throw new PivotCollisionException(problem);
            }
            if (!columns.contains(obs.getSignalId())) continue;
            WideRow row = rows.computeIfAbsent(RowKey.of(obs), RowKey::newRow);
            putMax(row, obs.getSignalId(), obs.getValue());
        }
        return toTable(columns, rows.values());
    }

    WideTable pivotByJoin(List<Observation> summary, Set<String> columns) {
        Map<String, Map<RowKey, Double>> subTables = new LinkedHashMap<>();
        int skipped = 0;
        for (Observation obs : summary) {
            if (keyProblem(obs) != null) {
                skipped++;
                continue;
            }
            if (!columns.contains(obs.getSignalId())) continue;
            subTables.computeIfAbsent(obs.getSignalId(), k -> new LinkedHashMap<>())
                    .merge(RowKey.of(obs), nanToNull(obs.getValue()), PivotShaper::max);
        }
        if (skipped > 0) {
            log.warn("[PIVOT] Fallback skipped {} row(s) without a usable key", skipped);
        }

        Map<RowKey, WideRow> joined = new LinkedHashMap<>();
        for (Map.Entry<String, Map<RowKey, Double>> sub : subTables.entrySet()) {
            for (Map.Entry<RowKey, Double> cell : sub.getValue().entrySet()) {
                WideRow row = joined.computeIfAbsent(cell.getKey(), RowKey::newRow);
                if (cell.getValue() != null) {
                    row.getValues().put(sub.getKey(), cell.getValue());
                }
            }
        }
        Set<String> present = new LinkedHashSet<>();
        for (String column : columns) {
            if (subTables.containsKey(column)) {
                present.add(column);
            }
        }
        return toTable(present, joined.values());
    }

    private static String keyProblem(Observation obs) {
        if (obs.getVesselId() == null || obs.getTimestamp() == null || obs.getLoadDate() == null) {
            return "row without full key: vessel=" + obs.getVesselId() + " timestamp=" + obs.getTimestamp();
        }
        if (obs.getSignalId() == null) {
            return "row without signal id: vessel=" + obs.getVesselId();
        }
        if (WideTable.KEY_COLUMNS.contains(obs.getSignalId())) {
            return "signal id collides with key column: " + obs.getSignalId();
        }
        return null;
    }

    private static void putMax(WideRow row, String signalId, Double value) {
        Double v = nanToNull(value);
        if (v == null) {
            return;
        }
        row.getValues().merge(signalId, v, Math::max);
    }

    private static Double max(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.max(a, b);
    }

    private static Double nanToNull(Double v) {
        return v == null || v.isNaN() ? null : v;
    }

    private static WideTable toTable(Collection<String> columns, Collection<WideRow> rows) {
        List<WideRow> sorted = new ArrayList<>(rows);
        sorted.sort(ROW_ORDER);
        return new WideTable(new ArrayList<>(columns), sorted);
    }

    private record RowKey(String vesselId, String timestamp, LocalDateTime loadDate) {

        static RowKey of(Observation obs) {
            return new RowKey(obs.getVesselId(), obs.getTimestamp(), obs.getLoadDate());
        }

        WideRow newRow() {
            return WideRow.builder().vesselId(vesselId).timestamp(timestamp).loadDate(loadDate).build();
        }
    }
}
