package com.di.fleetnova.model;

import java.util.List;
import java.util.Map;

/**
 * Flattened fleet payload: one row per ship plus one child table per list-valued
 * ship attribute, keyed by attribute name.
 */
public record FleetTables(List<Map<String, Object>> ships, Map<String, List<Map<String, Object>>> nested) {

    public FleetTables {
        ships = ships != null ? List.copyOf(ships) : List.of();
        nested = nested != null ? Map.copyOf(nested) : Map.of();
    }
}
