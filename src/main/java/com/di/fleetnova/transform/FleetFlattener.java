package com.di.fleetnova.transform;

import com.di.fleetnova.exception.SchemaException;
import com.di.fleetnova.model.FleetTables;
import com.di.fleetnova.model.PayloadShape;
import com.di.fleetnova.model.RawPayload;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the fleet listing ({@code [{imo, active, data: {...}}, ...]}) into the
 * active vessel id list and flat ship tables.
 */
@Slf4j
public class FleetFlattener {

    public static final String IMO_COLUMN       = "imo";
    public static final String LOAD_DATE_COLUMN = "loaddate";

    private static final String ACTIVE_FIELD = "active";
    private static final String DATA_FIELD   = "data";

    /**
     * Ids of ships whose {@code active} flag is absent or {@code true}, in payload order.
     *
     * @throws SchemaException when the payload is an error payload or not a list
     */
    public List<String> activeVesselIds(JsonNode fleet) {
        requireShipList(fleet);
        List<String> ids = new ArrayList<>();
        for (JsonNode ship : fleet) {
            if (!ship.hasNonNull(IMO_COLUMN)) {
                log.warn("[FLEET] skipping ship entry without imo");
                continue;
            }
            JsonNode active = ship.get(ACTIVE_FIELD);
            if (active == null || active.isNull() || active.asBoolean(true)) {
                ids.add(ship.get(IMO_COLUMN).asText());
            }
        }
        return ids;
    }

    /**
     * One row per ship with its {@code data} object unnested; list-valued attributes
     * are moved to child tables keyed by attribute name.
     */
    public FleetTables flattenFleet(JsonNode fleet, LocalDateTime loadDate) {
        requireShipList(fleet);
        String stamp = loadDate != null ? loadDate.toString() : null;

        List<Map<String, Object>> ships = new ArrayList<>();
        Map<String, List<Map<String, Object>>> nested = new LinkedHashMap<>();

        for (JsonNode ship : fleet) {
            Object imo = ship.hasNonNull(IMO_COLUMN) ? SignalFlattener.scalar(ship.get(IMO_COLUMN)) : null;
            Map<String, Object> row = new LinkedHashMap<>();

            Iterator<Map.Entry<String, JsonNode>> top = ship.fields();
            while (top.hasNext()) {
                Map.Entry<String, JsonNode> f = top.next();
                if (DATA_FIELD.equals(f.getKey()) && f.getValue().isObject()) {
                    unnestData(imo, f.getValue(), row, nested, stamp);
                } else if (f.getValue().isArray()) {
                    addChildRows(imo, f.getKey(), f.getValue(), nested, stamp);
                } else {
                    row.put(f.getKey(), SignalFlattener.scalar(f.getValue()));
                }
            }
            row.put(LOAD_DATE_COLUMN, stamp);
            ships.add(row);
        }
        return new FleetTables(ships, nested);
    }

    private static void unnestData(Object imo, JsonNode data, Map<String, Object> row,
                                   Map<String, List<Map<String, Object>>> nested, String stamp) {
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            JsonNode v = f.getValue();
            if (v.isArray()) {
                addChildRows(imo, f.getKey(), v, nested, stamp);
            } else if (v.isObject()) {
                SignalFlattener.liftFields(v).forEach((k, val) -> row.putIfAbsent(f.getKey() + "_" + k, val));
            } else {
                row.put(f.getKey(), SignalFlattener.scalar(v));
            }
        }
    }

    private static void addChildRows(Object imo, String name, JsonNode list,
                                     Map<String, List<Map<String, Object>>> nested, String stamp) {
        List<Map<String, Object>> rows = nested.computeIfAbsent(name, k -> new ArrayList<>());
        for (JsonNode element : list) {
            Map<String, Object> child = new LinkedHashMap<>();
            child.put(IMO_COLUMN, imo);
            if (element.isObject()) {
                child.putAll(SignalFlattener.liftFields(element));
            } else {
                child.put(name, SignalFlattener.scalar(element));
            }
            child.put(LOAD_DATE_COLUMN, stamp);
            rows.add(child);
        }
    }

    private static void requireShipList(JsonNode fleet) {
        RawPayload payload = RawPayload.of(fleet);
        if (payload.isError()) {
            throw new SchemaException("Fleet request error: " + payload.errorDetail(), PayloadShape.ERROR);
        }
        if (fleet == null || !fleet.isArray()) {
            throw new SchemaException("Fleet payload is not a list of ships", payload.getShape());
        }
    }
}
