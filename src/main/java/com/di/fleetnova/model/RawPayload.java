package com.di.fleetnova.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Loosely-typed payload as received from the data source, tagged with its
 * {@link PayloadShape}.
 *
 * <p>Timeseries payloads may carry a top-level {@code timestamp} field (the
 * response time); it is not a signal and is ignored by shape detection.
 */
public final class RawPayload {

    public static final String DETAIL_FIELD    = "detail";
    public static final String SIGNALS_FIELD   = "signals";
    public static final String TIMESTAMP_FIELD = "timestamp";

    private final PayloadShape shape;
    private final JsonNode     body;

    private RawPayload(PayloadShape shape, JsonNode body) {
        this.shape = shape;
        this.body = body;
    }

    public static RawPayload of(JsonNode body) {
        return new RawPayload(inspect(body), body);
    }

    public PayloadShape getShape() {
        return shape;
    }

    public JsonNode getBody() {
        return body;
    }

    public boolean isError() {
        return shape == PayloadShape.ERROR;
    }

    /** The {@code detail} message of an error payload, otherwise {@code null}. */
    public String errorDetail() {
        return isError() ? body.get(DETAIL_FIELD).asText() : null;
    }

    static PayloadShape inspect(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return PayloadShape.EMPTY;
        }
        if (body.isContainerNode() && body.isEmpty()) {
            return PayloadShape.EMPTY;
        }
        if (!body.isObject()) {
            return PayloadShape.UNKNOWN;
        }
        if (body.size() == 1 && body.has(DETAIL_FIELD)) {
            return PayloadShape.ERROR;
        }
        JsonNode signals = body.get(SIGNALS_FIELD);
        if (signals != null && signals.isObject()) {
            return PayloadShape.SCALAR;
        }
        return isNestedSeries(body) ? PayloadShape.NESTED_SERIES : PayloadShape.UNKNOWN;
    }

    private static boolean isNestedSeries(JsonNode body) {
        boolean sawSignal = false;
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (TIMESTAMP_FIELD.equals(field.getKey())) continue;
            JsonNode series = field.getValue();
            if (!series.isObject()) return false;
            for (JsonNode sample : series) {
                if (sample.isContainerNode()) return false;
            }
            sawSignal = true;
        }
        // only a response timestamp: nothing to flatten
        return sawSignal || body.size() == 1;
    }

    @Override
    public String toString() {
        return "RawPayload{shape=" + shape + "}";
    }
}
