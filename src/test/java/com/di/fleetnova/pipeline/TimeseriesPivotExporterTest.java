package com.di.fleetnova.pipeline;

import com.di.fleetnova.config.FleetPipelineProperties;
import com.di.fleetnova.config.PipelineContext;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.ObservationTag;
import com.di.fleetnova.model.PivotResult;
import com.di.fleetnova.model.WideRow;
import com.di.fleetnova.storage.LocalFileStore;
import com.di.fleetnova.storage.PartitionPaths;
import com.di.fleetnova.transform.PivotShaper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeseriesPivotExporter Tests")
class TimeseriesPivotExporterTest {

    @TempDir
    Path dataRoot;

    private final LocalFileStore store = new LocalFileStore();
    private FleetPipelineProperties props;
    private PartitionPaths paths;
    private TimeseriesPivotExporter exporter;

    @BeforeEach
    void setUp() {
        props = new FleetPipelineProperties();
        props.setDataRoot(dataRoot.toString());
        props.getPivotExport().setOutput(dataRoot.resolve("out/pivot.parquet").toString());
        paths = new PartitionPaths(props);
        exporter = new TimeseriesPivotExporter(store, paths,
                new PivotShaper(PipelineContext.from(props)), props);
    }

    private static Observation obs(String vessel, String signal, String ts, Double value, LocalDateTime load) {
        return Observation.builder().vesselId(vessel).signalId(signal).timestamp(ts)
                .value(value).loadDate(load).tag(ObservationTag.NEW).build();
    }

    private void writeRun(String partition, String vessel, List<Observation> rows) {
        store.writeTable(rows, "Timeseries_" + vessel, paths.transformed(partition));
    }

    @Test
    @DisplayName("Should pick the latest run of each day, newest day first")
    void testLatestRunPerDay() {
        LocalDateTime load = LocalDateTime.of(2024, 3, 1, 8, 0);
        writeRun("2024/03/01/08/00", "1", List.of(obs("1", "rpm", "t1", 1.0, load)));
        writeRun("2024/03/01/16/30", "1", List.of(obs("1", "rpm", "t1", 2.0, load)));
        writeRun("2024/03/02/09/15", "1", List.of(obs("1", "rpm", "t2", 3.0, load)));
        // a later run without timeseries tables is ignored
        store.writeTable(List.of(Map.of("imo", "1")), "ShipData", paths.transformed("2024/03/02/23/59"));

        List<Path> runs = exporter.latestRunPerDay(paths.transformedRoot(), null);

        assertEquals(List.of(paths.transformed("2024/03/02/09/15"), paths.transformed("2024/03/01/16/30")), runs);
        assertEquals(List.of(paths.transformed("2024/03/02/09/15")),
                exporter.latestRunPerDay(paths.transformedRoot(), 1));
    }

    @Test
    @DisplayName("Should return no runs for a missing root")
    void testLatestRunPerDay_MissingRoot() {
        assertTrue(exporter.latestRunPerDay(dataRoot.resolve("nope"), null).isEmpty());
    }

    @Test
    @DisplayName("Should drop nulls and keep the latest load date per key")
    void testDedupLatest() {
        LocalDateTime early = LocalDateTime.of(2024, 3, 1, 8, 0);
        LocalDateTime late = early.plusHours(6);

        List<Observation> result = TimeseriesPivotExporter.dedupLatest(List.of(
                obs("1", "rpm", "t1", 1.0, early),
                obs("1", "rpm", "t1", 2.0, late),
                obs("1", "rpm", "t1", 3.0, early),
                obs("1", "temp", "t1", null, late)));

        assertEquals(1, result.size());
        assertEquals(2.0, result.get(0).getValue());
    }

    @Test
    @DisplayName("Should export one wide table across days")
    void testExport() {
        LocalDateTime d1 = LocalDateTime.of(2024, 3, 1, 16, 30);
        LocalDateTime d2 = LocalDateTime.of(2024, 3, 2, 9, 15);
        writeRun("2024/03/01/16/30", "1", List.of(obs("1", "rpm", "t1", 1.0, d1)));
        writeRun("2024/03/02/09/15", "1", List.of(obs("1", "rpm", "t1", 5.0, d2), obs("1", "temp", "t1", 20.0, d2),
                obs("1", "rpm", "t2", 6.0, d2)));
        writeRun("2024/03/02/09/15", "2", List.of(obs("2", "rpm", "t1", 7.0, d2)));

        PivotResult result = exporter.export();

        assertEquals(List.of("rpm", "temp"), List.copyOf(result.getTable().signalColumns()));
        assertEquals(3, result.getTable().rows().size());
        WideRow first = result.getTable().rows().get(0);
        assertEquals("1", first.getVesselId());
        assertEquals("t1", first.getTimestamp());
        assertEquals(5.0, first.value("rpm"));
        assertEquals(20.0, first.value("temp"));

        List<Map<String, Object>> written = store.readRows("pivot", dataRoot.resolve("out"));
        assertEquals(3, written.size());
        assertEquals("1", written.get(0).get("vessel_id"));
    }

    @Test
    @DisplayName("Should return an empty result when nothing was stored")
    void testExport_Empty() {
        assertTrue(exporter.export().getTable().isEmpty());
    }
}
