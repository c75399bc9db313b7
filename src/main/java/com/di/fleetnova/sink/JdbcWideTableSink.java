package com.di.fleetnova.sink;

import com.di.fleetnova.config.SinkProperties;
import com.di.fleetnova.exception.MalformedTimestampException;
import com.di.fleetnova.exception.PersistenceException;
import com.di.fleetnova.model.GapInterval;
import com.di.fleetnova.model.PivotResult;
import com.di.fleetnova.model.WideRow;
import com.di.fleetnova.model.WideTable;
import com.di.fleetnova.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of {@link WideTableSink}.
 *
 * <p>Per write: create tables if missing, add new signal columns as nullable
 * {@code DOUBLE PRECISION}, refill the staging table, merge staging into the pivot table
 * keyed by (vessel_id, signal_timestamp), then upsert gaps keyed by
 * (vessel_id, signal_id, gap_start). All of it runs in one transaction.
 * Every identifier is double-quoted. PostgreSQL truncates identifiers to
 * {@value #MAX_IDENTIFIER_BYTES} bytes, so signals whose id is longer are not
 * written to the pivot table and are logged instead.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "fleetnova.sink.enabled", havingValue = "true")
public class JdbcWideTableSink implements WideTableSink {

    static final String VESSEL_COL    = WideTable.KEY_COLUMNS.get(0);
    static final String TIMESTAMP_COL = WideTable.KEY_COLUMNS.get(1);
    static final String LOAD_DATE_COL = WideTable.KEY_COLUMNS.get(2);

    static final int MAX_IDENTIFIER_BYTES = 63;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final SinkProperties props;

    public JdbcWideTableSink(JdbcTemplate sinkJdbcTemplate, TransactionTemplate sinkTransactionTemplate,
                             SinkProperties props) {
        this.jdbc = sinkJdbcTemplate;
        this.tx = sinkTransactionTemplate;
        this.props = props;
    }

    @Override
    public void verifyConnection() {
        try {
            jdbc.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            throw new PersistenceException("Sink database not reachable: " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> existingSignalColumns() {
        try {
            List<String> columns = jdbc.queryForList(
                    "SELECT column_name FROM information_schema.columns WHERE table_name = ? ORDER BY ordinal_position",
                    String.class, props.getPivotTable());
            Set<String> signals = new LinkedHashSet<>(columns);
            WideTable.KEY_COLUMNS.forEach(signals::remove);
            return signals;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read columns of " + props.getPivotTable(), e);
        }
    }

    @Override
    public void write(PivotResult pivot, List<GapInterval> gaps) {
        WideTable table = pivot.getTable();
        List<String> columns = storableColumns(table.signalColumns());
        List<String> newColumns = pivot.getSchemaDelta().newColumns().stream()
                .filter(JdbcWideTableSink::fitsIdentifier)
                .toList();
        try {
            tx.executeWithoutResult(status -> {
                jdbc.execute(createPivotTableSql(props.getPivotTable()));
                for (String ddl : addColumnSql(props.getPivotTable(), newColumns)) {
                    jdbc.execute(ddl);
                }
                if (!table.isEmpty()) {
                    jdbc.execute(dropTableSql(props.getStagingTable()));
                    jdbc.execute(createStagingTableSql(props.getStagingTable(), columns));
                    int staged = insertStaging(table, columns);
                    int merged = jdbc.update(mergeSql(props.getPivotTable(), props.getStagingTable(), columns));
                    log.info("[SINK] staged={} merged={} into {}", staged, merged, props.getPivotTable());
                }
                if (!gaps.isEmpty()) {
                    jdbc.execute(createGapsTableSql(props.getGapsTable()));
                    int[][] counts = jdbc.batchUpdate(upsertGapSql(props.getGapsTable()), gaps, props.getBatchSize(),
                            (ps, gap) -> {
                                ps.setString(1, gap.getVesselId());
                                ps.setString(2, gap.getSignalId());
                                ps.setTimestamp(3, Timestamp.from(gap.getGapStart()));
                                ps.setTimestamp(4, Timestamp.from(gap.getGapEnd()));
                                ps.setTimestamp(5, gap.getLoadDate() != null ? Timestamp.valueOf(gap.getLoadDate()) : null);
                            });
                    log.info("[SINK] upserted {} gap interval(s) in {} batch(es)", gaps.size(), counts.length);
                }
            });
        } catch (DataAccessException e) {
            throw new PersistenceException("Sink write failed: " + e.getMessage(), e);
        }
    }

    private int insertStaging(WideTable table, List<String> columns) {
        List<Object[]> batch = new ArrayList<>(props.getBatchSize());
        String sql = insertStagingSql(props.getStagingTable(), columns);
        int staged = 0;
        int skipped = 0;
        for (WideRow row : table.rows()) {
            Timestamp ts;
            try {
                ts = Timestamp.from(TimestampParser.parse(row.getTimestamp()));
            } catch (MalformedTimestampException e) {
                skipped++;
                continue;
            }
            Object[] args = new Object[3 + columns.size()];
            args[0] = row.getVesselId();
            args[1] = ts;
            args[2] = row.getLoadDate() != null ? Timestamp.valueOf(row.getLoadDate()) : null;
            for (int i = 0; i < columns.size(); i++) {
                args[3 + i] = row.value(columns.get(i));
            }
            batch.add(args);
            if (batch.size() >= props.getBatchSize()) {
                jdbc.batchUpdate(sql, batch);
                staged += batch.size();
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            jdbc.batchUpdate(sql, batch);
            staged += batch.size();
        }
        if (skipped > 0) {
            log.warn("[SINK] skipped {} row(s) with unparseable timestamps", skipped);
        }
        return staged;
    }

    // ------------------------------------------------------------------ //
    // Statement generation                                                //
    // ------------------------------------------------------------------ //

    /** Signal columns that fit a PostgreSQL identifier; the others are logged and left out. */
    static List<String> storableColumns(List<String> signalColumns) {
        List<String> storable = new ArrayList<>(signalColumns.size());
        List<String> tooLong = new ArrayList<>();
        for (String column : signalColumns) {
            (fitsIdentifier(column) ? storable : tooLong).add(column);
        }
        if (!tooLong.isEmpty()) {
            log.warn("[SINK] {} signal id(s) exceed {} bytes and are not written: {}",
                    tooLong.size(), MAX_IDENTIFIER_BYTES, tooLong);
        }
        return storable;
    }

    static boolean fitsIdentifier(String identifier) {
        return identifier.getBytes(StandardCharsets.UTF_8).length <= MAX_IDENTIFIER_BYTES;
    }

    static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }
        if (!fitsIdentifier(identifier)) {
            throw new IllegalArgumentException("identifier exceeds " + MAX_IDENTIFIER_BYTES + " bytes: " + identifier);
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    static String createPivotTableSql(String table) {
        return "CREATE TABLE IF NOT EXISTS " + quote(table) + " ("
                + quote(VESSEL_COL) + " TEXT NOT NULL, "
                + quote(TIMESTAMP_COL) + " TIMESTAMPTZ NOT NULL, "
                + quote(LOAD_DATE_COL) + " TIMESTAMP, "
                + "PRIMARY KEY (" + quote(VESSEL_COL) + ", " + quote(TIMESTAMP_COL) + "))";
    }

    static List<String> addColumnSql(String table, List<String> newColumns) {
        List<String> ddl = new ArrayList<>(newColumns.size());
        for (String column : newColumns) {
            ddl.add("ALTER TABLE " + quote(table) + " ADD COLUMN IF NOT EXISTS " + quote(column) + " DOUBLE PRECISION");
        }
        return ddl;
    }

    static String dropTableSql(String table) {
        return "DROP TABLE IF EXISTS " + quote(table);
    }

    static String createStagingTableSql(String table, List<String> signalColumns) {
        StringBuilder sb = new StringBuilder("CREATE TABLE ").append(quote(table)).append(" (")
                .append(quote(VESSEL_COL)).append(" TEXT, ")
                .append(quote(TIMESTAMP_COL)).append(" TIMESTAMPTZ, ")
                .append(quote(LOAD_DATE_COL)).append(" TIMESTAMP");
        for (String column : signalColumns) {
            sb.append(", ").append(quote(column)).append(" DOUBLE PRECISION");
        }
        return sb.append(")").toString();
    }

    static String insertStagingSql(String table, List<String> signalColumns) {
        List<String> all = new ArrayList<>(WideTable.KEY_COLUMNS);
        all.addAll(signalColumns);
        return "INSERT INTO " + quote(table) + " (" + quotedList(all) + ") VALUES ("
                + all.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
    }

    /**
     * Staging rows sharing (vessel_id, signal_timestamp) are collapsed with MAX so the upsert
     * touches every target row once; existing values survive a {@code NULL} in the new row.
     */
    static String mergeSql(String pivotTable, String stagingTable, List<String> signalColumns) {
        List<String> all = new ArrayList<>(WideTable.KEY_COLUMNS);
        all.addAll(signalColumns);

        StringBuilder select = new StringBuilder()
                .append(quote(VESSEL_COL)).append(", ")
                .append(quote(TIMESTAMP_COL)).append(", ")
                .append("MAX(").append(quote(LOAD_DATE_COL)).append(")");
        for (String column : signalColumns) {
            select.append(", MAX(").append(quote(column)).append(")");
        }

        StringBuilder update = new StringBuilder()
                .append(quote(LOAD_DATE_COL)).append(" = EXCLUDED.").append(quote(LOAD_DATE_COL));
        for (String column : signalColumns) {
            update.append(", ").append(quote(column)).append(" = COALESCE(EXCLUDED.").append(quote(column))
                    .append(", ").append(quote(pivotTable)).append(".").append(quote(column)).append(")");
        }

        return "INSERT INTO " + quote(pivotTable) + " (" + quotedList(all) + ") "
                + "SELECT " + select + " FROM " + quote(stagingTable)
                + " GROUP BY " + quote(VESSEL_COL) + ", " + quote(TIMESTAMP_COL)
                + " ON CONFLICT (" + quote(VESSEL_COL) + ", " + quote(TIMESTAMP_COL) + ") DO UPDATE SET " + update;
    }

    static String createGapsTableSql(String table) {
        return "CREATE TABLE IF NOT EXISTS " + quote(table) + " ("
                + "\"vessel_id\" TEXT NOT NULL, "
                + "\"signal_id\" TEXT NOT NULL, "
                + "\"gap_start\" TIMESTAMPTZ NOT NULL, "
                + "\"gap_end\" TIMESTAMPTZ NOT NULL, "
                + "\"load_date\" TIMESTAMP, "
                + "PRIMARY KEY (\"vessel_id\", \"signal_id\", \"gap_start\"))";
    }

    static String upsertGapSql(String table) {
        return "INSERT INTO " + quote(table)
                + " (\"vessel_id\", \"signal_id\", \"gap_start\", \"gap_end\", \"load_date\") VALUES (?, ?, ?, ?, ?)"
                + " ON CONFLICT (\"vessel_id\", \"signal_id\", \"gap_start\") DO UPDATE SET"
                + " \"gap_end\" = EXCLUDED.\"gap_end\", \"load_date\" = EXCLUDED.\"load_date\"";
    }

    private static String quotedList(List<String> identifiers) {
        return identifiers.stream().map(JdbcWideTableSink::quote).collect(Collectors.joining(", "));
    }
}
