package com.di.fleetnova.transform;

import com.di.fleetnova.config.PipelineContext;
import com.di.fleetnova.exception.SchemaException;
import com.di.fleetnova.model.FlattenedTimeseries;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.ObservationTag;
import com.di.fleetnova.model.RawPayload;
import com.di.fleetnova.model.SignalRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SignalFlattener Tests")
class SignalFlattenerTest {

    private static final LocalDateTime LOAD = LocalDateTime.of(2024, 3, 1, 12, 0);

    private final ObjectMapper mapper = new ObjectMapper();
    private final SignalFlattener flattener = new SignalFlattener();

    private RawPayload payload(String json) throws Exception {
        return RawPayload.of(mapper.readTree(json));
    }

    // ============================================================================
    // Timeseries shape
    // ============================================================================

    @Test
    @DisplayName("Should split timeseries into clean and null streams")
    void testFlattenTimeseries_SplitsNulls() throws Exception {
        FlattenedTimeseries out = flattener.flattenTimeseries("9000001", payload("""
                {
                  "timestamp": "2024-03-01T12:00:00Z",
                  "rpm":  {"2024-03-01T10:00:00Z": 80.5, "2024-03-01T10:05:00Z": null},
                  "temp": {"2024-03-01T10:00:00Z": 41}
                }
                """), LOAD);

        assertEquals(2, out.clean().size());
        assertEquals(1, out.nulls().size());

        Observation rpm = out.clean().get(0);
        assertEquals("9000001", rpm.getVesselId());
        assertEquals("rpm", rpm.getSignalId());
        assertEquals("2024-03-01T10:00:00Z", rpm.getTimestamp());
        assertEquals(80.5, rpm.getValue());
        assertEquals(LOAD, rpm.getLoadDate());
        assertEquals(ObservationTag.NEW, rpm.getTag());

        Observation gap = out.nulls().get(0);
        assertEquals("rpm", gap.getSignalId());
        assertEquals("2024-03-01T10:05:00Z", gap.getTimestamp());
        assertNull(gap.getValue());
    }

    @Test
    @DisplayName("Should produce empty typed result for empty input")
    void testFlattenTimeseries_Empty() throws Exception {
        FlattenedTimeseries empty = flattener.flattenTimeseries("9000001", payload("{}"), LOAD);
        FlattenedTimeseries none = flattener.flattenTimeseries("9000001", null, LOAD);

        for (FlattenedTimeseries out : List.of(empty, none)) {
            assertTrue(out.isEmpty());
            assertNotNull(out.clean());
            assertNotNull(out.nulls());
            assertTrue(out.clean().isEmpty());
            assertTrue(out.nulls().isEmpty());
        }
    }

    @Test
    @DisplayName("Should short-circuit error payloads to empty output")
    void testFlattenTimeseries_ErrorPayload() throws Exception {
        FlattenedTimeseries out = flattener.flattenTimeseries("9000001",
                payload("{\"detail\": \"Ship not found\"}"), LOAD);
        assertTrue(out.isEmpty());
    }

    @Test
    @DisplayName("Should reject payloads of the wrong shape with SchemaException")
    void testFlattenTimeseries_WrongShape() throws Exception {
        RawPayload signals = payload("{\"signals\": {\"rpm\": {\"unit\": \"1/min\"}}}");
        assertThrows(SchemaException.class, () -> flattener.flattenTimeseries("9000001", signals, LOAD));
    }

    @Test
    @DisplayName("Should convert booleans and numeric text and drop other text")
    void testFlattenTimeseries_ValueConversion() throws Exception {
        FlattenedTimeseries out = flattener.flattenTimeseries("9000001", payload("""
                {"s": {"t1": true, "t2": false, "t3": "12.5", "t4": "n/a", "t5": null}}
                """), LOAD);

        assertEquals(3, out.clean().size());
        assertEquals(1.0, out.clean().get(0).getValue());
        assertEquals(0.0, out.clean().get(1).getValue());
        assertEquals(12.5, out.clean().get(2).getValue());
        assertEquals(1, out.nulls().size());
        assertEquals("t5", out.nulls().get(0).getTimestamp());
    }

    @Test
    @DisplayName("Should not turn reported text samples into gaps")
    void testFlattenTimeseries_TextSamplesAreNotGaps() throws Exception {
        FlattenedTimeseries out = flattener.flattenTimeseries("9000001", payload("""
                {"status": {"2024-03-01T10:00:00Z": "RUNNING", "2024-03-01T10:01:00Z": "STOPPED"}}
                """), LOAD);

        assertTrue(out.clean().isEmpty());
        assertTrue(out.nulls().isEmpty());
        assertTrue(new GapDetector(new PipelineContext(Duration.ofMinutes(5), 5, null))
                .detect(out.nulls()).isEmpty());
    }

    // ============================================================================
    // Signals shape
    // ============================================================================

    @Test
    @DisplayName("Should produce one record per signal with nested fields lifted")
    void testFlattenSignals() throws Exception {
        List<SignalRecord> records = flattener.flattenSignals("ignored", payload("""
                {
                  "imo": "9000002",
                  "signals": {
                    "sig_a": {"friendly_name": "Main engine RPM", "unit": "1/min",
                              "meta": {"group_name": "Engine", "unit": "rpm"}},
                    "sig_b": 7
                  }
                }
                """), LOAD);

        assertEquals(2, records.size());
        SignalRecord a = records.get(0);
        assertEquals("9000002", a.getVesselId());
        assertEquals("sig_a", a.getSignalId());
        assertEquals(LOAD, a.getLoadDate());

        Map<String, Object> attrs = a.getAttributes();
        assertEquals("Main engine RPM", attrs.get("friendly_name"));
        assertEquals("1/min", attrs.get("unit"));
        assertEquals("Engine", attrs.get("group_name"));
        assertEquals("rpm", attrs.get("meta_unit"));

        assertEquals(7, ((Number) records.get(1).getAttributes().get("value")).intValue());
    }

    @Test
    @DisplayName("Should return empty list for empty or error signals payloads")
    void testFlattenSignals_EmptyAndError() throws Exception {
        assertTrue(flattener.flattenSignals("1", payload("{}"), LOAD).isEmpty());
        assertTrue(flattener.flattenSignals("1", payload("{\"detail\":\"x\"}"), LOAD).isEmpty());
    }
}
