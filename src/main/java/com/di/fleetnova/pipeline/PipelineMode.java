package com.di.fleetnova.pipeline;

import java.util.Locale;

/**
 * What a run does. Every mode ends with retention cleanup.
 */
public enum PipelineMode {

    /** Fleet, signal catalog and timeseries. */
    ALL,
    /** Fleet and signal catalog only. */
    FLEET,
    /** Timeseries only, using the persisted vessel list and catalog. */
    TIMESERIES,
    /** Pivot export over the stored timeseries tables. */
    PIVOT_EXPORT;

    public boolean includesFleet() {
        return this == ALL || this == FLEET;
    }

    public boolean includesTimeseries() {
        return this == ALL || this == TIMESERIES;
    }

    /**
     * Parses the command-line form ({@code all}, {@code fleet}, {@code timeseries}, {@code pivot-export}).
     */
    public static PipelineMode fromCliValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode '" + value
                    + "'; expected one of all, fleet, timeseries, pivot-export", e);
        }
    }
}
