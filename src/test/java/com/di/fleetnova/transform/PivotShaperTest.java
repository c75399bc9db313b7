package com.di.fleetnova.transform;

import com.di.fleetnova.config.PipelineContext;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.PivotResult;
import com.di.fleetnova.model.SchemaDelta;
import com.di.fleetnova.model.WideRow;
import com.di.fleetnova.model.WideTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PivotShaper Tests")
class PivotShaperTest {

    private static final LocalDateTime LOAD = LocalDateTime.of(2024, 3, 1, 12, 0);

    private static PivotShaper shaper(Integer cap) {
        return new PivotShaper(new PipelineContext(Duration.ofMinutes(5), 5, cap));
    }

    private static Observation obs(String vessel, String signal, String ts, Double value) {
        return Observation.builder().vesselId(vessel).signalId(signal).timestamp(ts).value(value).loadDate(LOAD).build();
    }

    private static List<Observation> withCounts(String signal, int count, List<Observation> into) {
        for (int i = 0; i < count; i++) {
            into.add(obs("v1", signal, String.format("2024-03-01T10:%02d:00Z", i), (double) i));
        }
        return into;
    }

    // ============================================================================
    // Direct path
    // ============================================================================

    @Test
    @DisplayName("Should pivot long rows into one row per vessel and timestamp")
    void testPivot_Direct() {
        PivotResult result = shaper(null).pivot(List.of(
                obs("v2", "rpm", "t1", 80.0),
                obs("v1", "temp", "t1", 40.0),
                obs("v1", "rpm", "t1", 75.0),
                obs("v1", "rpm", "t2", 76.0)));

        WideTable table = result.getTable();
        assertFalse(result.isFallbackUsed());
        assertEquals(List.of("rpm", "temp"), table.signalColumns());
        assertEquals(3, table.rows().size());

        WideRow first = table.rows().get(0);
        assertEquals("v1", first.getVesselId());
        assertEquals("t1", first.getTimestamp());
        assertEquals(LOAD, first.getLoadDate());
        assertEquals(75.0, first.value("rpm"));
        assertEquals(40.0, first.value("temp"));

        WideRow second = table.rows().get(1);
        assertEquals("t2", second.getTimestamp());
        assertNull(second.value("temp"));

        assertEquals("v2", table.rows().get(2).getVesselId());
    }

    @Test
    @DisplayName("Should keep the maximum value for duplicate keys")
    void testPivot_DuplicatesKeepMax() {
        PivotResult result = shaper(null).pivot(List.of(
                obs("v1", "rpm", "t1", 10.0),
                obs("v1", "rpm", "t1", 30.0),
                obs("v1", "rpm", "t1", 20.0)));

        assertEquals(1, result.getTable().rows().size());
        assertEquals(30.0, result.getTable().rows().get(0).value("rpm"));
        assertFalse(result.isFallbackUsed());
    }

    @Test
    @DisplayName("Should return an empty result for empty input")
    void testPivot_Empty() {
        PivotResult result = shaper(null).pivot(List.of());
        assertTrue(result.getTable().isEmpty());
        assertTrue(result.getSchemaDelta().isEmpty());
        assertTrue(result.getDroppedSignals().isEmpty());
    }

    // ============================================================================
    // Column cap
    // ============================================================================

    @Test
    @DisplayName("Should keep the most frequent signals with ties broken by ascending id")
    void testPivot_ColumnCapDeterminism() {
        List<Observation> rows = new ArrayList<>();
        withCounts("D", 2, rows);
        withCounts("C", 7, rows);
        withCounts("B", 7, rows);
        withCounts("A", 10, rows);

        PivotResult result = shaper(2).pivot(rows);

        assertEquals(List.of("A", "B"), result.getTable().signalColumns());
        assertEquals(List.of("C", "D"), result.getDroppedSignals());
        assertTrue(result.getTable().rows().stream()
                .allMatch(r -> Set.of("A", "B").containsAll(r.getValues().keySet())));
    }

    @Test
    @DisplayName("Should rank signals by count then id")
    void testRankSignals() {
        List<Observation> rows = new ArrayList<>();
        withCounts("z", 3, rows);
        withCounts("a", 1, rows);
        withCounts("m", 3, rows);
        assertEquals(List.of("m", "z", "a"), PivotShaper.rankSignals(rows));
    }

    // ============================================================================
    // Fallback path
    // ============================================================================

    @Test
    @DisplayName("Should fall back to the join path when rows cannot be keyed")
    void testPivot_FallbackOnCollision() {
        PivotResult result = shaper(null).pivot(List.of(
                obs("v1", "rpm", "t1", 10.0),
                obs("v1", "temp", "t1", 40.0),
                obs("v1", "vessel_id", "t1", 99.0),
                obs(null, "rpm", "t2", 11.0),
                obs("v1", "rpm", "t3", 12.0)));

        assertTrue(result.isFallbackUsed());
        WideTable table = result.getTable();
        assertEquals(List.of("rpm", "temp"), table.signalColumns());
        assertEquals(2, table.rows().size());
        assertEquals(10.0, table.rows().get(0).value("rpm"));
        assertEquals(40.0, table.rows().get(0).value("temp"));
        assertEquals("t3", table.rows().get(1).getTimestamp());
        assertNull(table.rows().get(1).value("temp"));
    }

    @Test
    @DisplayName("Should produce the same table on both paths for well-formed input")
    void testPivot_PathsAgree() {
        List<Observation> rows = List.of(
                obs("v1", "a", "t1", 1.0), obs("v1", "b", "t1", 2.0),
                obs("v1", "a", "t2", 3.0), obs("v2", "b", "t1", 4.0),
                obs("v2", "b", "t1", 5.0));
        PivotShaper shaper = shaper(null);
        Set<String> columns = Set.of("a", "b");

        WideTable direct = shaper.pivotDirect(rows, new java.util.TreeSet<>(columns));
        WideTable joined = shaper.pivotByJoin(rows, new java.util.TreeSet<>(columns));

        assertEquals(direct.signalColumns(), joined.signalColumns());
        assertEquals(direct.rows(), joined.rows());
    }

    // ============================================================================
    // Schema delta
    // ============================================================================

    @Test
    @DisplayName("Should report only columns missing from the persistent table")
    void testPivot_SchemaDelta() {
        PivotResult result = shaper(null).pivot(List.of(
                obs("v1", "rpm", "t1", 1.0),
                obs("v1", "temp", "t1", 2.0),
                obs("v1", "speed", "t1", 3.0)), List.of("rpm", "old_signal"));

        assertEquals(List.of("speed", "temp"), result.getSchemaDelta().newColumns());
    }

    @Test
    @DisplayName("Should report no delta when all columns exist")
    void testSchemaDelta_None() {
        SchemaDelta delta = PivotShaper.schemaDelta(List.of("a"), List.of("a", "b"));
        assertTrue(delta.isEmpty());
    }
}
