package com.di.fleetnova.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance label telling which retention layer produced an {@link Observation}.
 */
public enum ObservationTag {

    /** Fetched by the current run. */
    NEW("new"),
    /** Accumulated earlier today (daily partition). */
    TODAY("today"),
    /** Archived from a previous day (historical partition). */
    HIST("hist");

    private final String wireName;

    ObservationTag(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Rows with this tag belong to the published summary. */
    public boolean isPublished() {
        return this == NEW || this == TODAY;
    }

    @JsonCreator
    public static ObservationTag fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (ObservationTag tag : values()) {
            if (tag.wireName.equalsIgnoreCase(value.trim())) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Unknown observation tag: " + value);
    }
}
