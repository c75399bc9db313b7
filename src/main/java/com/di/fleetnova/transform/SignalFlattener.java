package com.di.fleetnova.transform;

import com.di.fleetnova.exception.SchemaException;
import com.di.fleetnova.model.FlattenedTimeseries;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.ObservationTag;
import com.di.fleetnova.model.PayloadShape;
import com.di.fleetnova.model.RawPayload;
import com.di.fleetnova.model.SignalRecord;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unnests one vessel's raw payload into long-form rows.
 *
 * <ul>
 *   <li>Timeseries ({@link PayloadShape#NESTED_SERIES}): one {@link Observation}
 *       per (signal, timestamp), split into a clean stream and a null stream.</li>
 *   <li>Signals ({@link PayloadShape#SCALAR}): one {@link SignalRecord} per signal,
 *       nested sub-fields lifted one level.</li>
 * </ul>
 *
 * Empty payloads give empty results. Error payloads ({@code {"detail": ...}}) are
 * logged and give empty results. Only JSON {@code null} samples reach the null stream;
 * samples that are present but not numeric are dropped and counted. Stateless and thread-safe.
 */
@Slf4j
public class SignalFlattener {

    private static final String IMO_FIELD = "imo";

    /**
     * Flattens a timeseries payload. Every produced row is tagged {@link ObservationTag#NEW}.
     *
     * @throws SchemaException when the payload is neither empty, an error payload nor a nested series
     */
    public FlattenedTimeseries flattenTimeseries(String vesselId, RawPayload payload, LocalDateTime loadDate) {
        if (payload == null || payload.getShape() == PayloadShape.EMPTY) {
            return FlattenedTimeseries.empty();
        }
        if (payload.isError()) {
            log.warn("[FLATTEN] vessel={} timeseries request error: {}", vesselId, payload.errorDetail());
            return FlattenedTimeseries.empty();
        }
        if (payload.getShape() != PayloadShape.NESTED_SERIES) {
            throw new SchemaException("Expected a timeseries payload for vessel " + vesselId
                    + " but got " + payload.getShape(), payload.getShape());
        }

        List<Observation> clean = new ArrayList<>();
        List<Observation> nulls = new ArrayList<>();
        int nonNumeric = 0;

        Iterator<Map.Entry<String, JsonNode>> signals = payload.getBody().fields();
        while (signals.hasNext()) {
            Map.Entry<String, JsonNode> signal = signals.next();
            if (RawPayload.TIMESTAMP_FIELD.equals(signal.getKey())) continue;

            Iterator<Map.Entry<String, JsonNode>> samples = signal.getValue().fields();
            while (samples.hasNext()) {
                Map.Entry<String, JsonNode> sample = samples.next();
                boolean missing = sample.getValue() == null || sample.getValue().isNull();
                Double value = missing ? null : numericValue(sample.getValue());
                if (!missing && value == null) {
                    // present but not a number: neither a value nor a gap
                    nonNumeric++;
                    continue;
                }
                Observation obs = Observation.builder()
                        .vesselId(vesselId)
                        .signalId(signal.getKey())
                        .timestamp(sample.getKey())
                        .value(value)
                        .loadDate(loadDate)
                        .tag(ObservationTag.NEW)
                        .build();
                (missing ? nulls : clean).add(obs);
            }
        }
        if (nonNumeric > 0) {
            log.warn("[FLATTEN] vessel={} dropped {} non-numeric sample(s)", vesselId, nonNumeric);
        }
        log.debug("[FLATTEN] vessel={} clean={} nulls={}", vesselId, clean.size(), nulls.size());
        return new FlattenedTimeseries(clean, nulls);
    }

    /**
     * Flattens a signals payload into one record per signal. The vessel id is taken
     * from the payload's {@code imo} field when present.
     *
     * @throws SchemaException when the payload is neither empty, an error payload nor a signals payload
     */
    public List<SignalRecord> flattenSignals(String vesselId, RawPayload payload, LocalDateTime loadDate) {
        if (payload == null || payload.getShape() == PayloadShape.EMPTY) {
            return List.of();
        }
        if (payload.isError()) {
            log.warn("[FLATTEN] vessel={} signals request error: {}", vesselId, payload.errorDetail());
            return List.of();
        }
        if (payload.getShape() != PayloadShape.SCALAR) {
            throw new SchemaException("Expected a signals payload for vessel " + vesselId
                    + " but got " + payload.getShape(), payload.getShape());
        }

        JsonNode body = payload.getBody();
        String imo = body.hasNonNull(IMO_FIELD) ? body.get(IMO_FIELD).asText() : vesselId;

        List<SignalRecord> out = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> signals = body.get(RawPayload.SIGNALS_FIELD).fields();
        while (signals.hasNext()) {
            Map.Entry<String, JsonNode> signal = signals.next();
            out.add(SignalRecord.builder()
                    .vesselId(imo)
                    .signalId(signal.getKey())
                    .attributes(liftFields(signal.getValue()))
                    .loadDate(loadDate)
                    .build());
        }
        return out;
    }

    /**
     * Converts a structured value into a flat attribute map. Fields of nested
     * objects move up one level; a nested field whose name is already taken is
     * stored as {@code parent_child}. Scalars are kept under {@code value}.
     */
    static Map<String, Object> liftFields(JsonNode value) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (value == null || value.isNull()) {
            return attrs;
        }
        if (!value.isObject()) {
            attrs.put("value", scalar(value));
            return attrs;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (!f.getValue().isObject()) {
                attrs.put(f.getKey(), scalar(f.getValue()));
            }
        }
        fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (!f.getValue().isObject()) continue;
            Iterator<Map.Entry<String, JsonNode>> nested = f.getValue().fields();
            while (nested.hasNext()) {
                Map.Entry<String, JsonNode> n = nested.next();
                String name = attrs.containsKey(n.getKey()) ? f.getKey() + "_" + n.getKey() : n.getKey();
                attrs.put(name, scalar(n.getValue()));
            }
        }
        return attrs;
    }

    static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isIntegralNumber()) return node.longValue();
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) return node.textValue();
        // arrays and deeper objects stay as JSON text
        return node.toString();
    }

    /** Numeric reading of a present sample, {@code null} when it has none. */
    private static Double numericValue(JsonNode node) {
        if (node.isNumber()) return node.doubleValue();
        if (node.isBoolean()) return node.booleanValue() ? 1.0 : 0.0;
        if (node.isTextual()) {
            try {
                return Double.valueOf(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
