package com.di.fleetnova.model;

import java.util.List;

/**
 * Pivoted table. {@code signalColumns} lists the value columns in output order;
 * rows are sorted by (vessel, timestamp, load date).
 */
public record WideTable(List<String> signalColumns, List<WideRow> rows) {

    public static final List<String> KEY_COLUMNS = List.of("vessel_id", "signal_timestamp", "load_date");

    public WideTable {
        signalColumns = signalColumns != null ? List.copyOf(signalColumns) : List.of();
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    public static WideTable empty() {
        return new WideTable(List.of(), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
