package com.di.fleetnova.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One long-form telemetry observation: a single value of one signal of one vessel
 * at one point in time.
 *
 * <p>{@code timestamp} is kept exactly as the data source sent it; it is parsed
 * only where time arithmetic is needed (gap detection).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Observation {

    private String         vesselId;
    private String         signalId;
    private String         timestamp;
    private Double         value;
    private LocalDateTime  loadDate;

    /** Human-readable label from the signal catalog; {@code null} when unmapped. */
    private String         friendlyName;

    private ObservationTag tag;

    /** Identity used by retention-window deduplication. */
    public ObservationKey dedupKey() {
        return new ObservationKey(vesselId, signalId, timestamp, friendlyName);
    }

    public Observation withTag(ObservationTag newTag) {
        return toBuilder().tag(newTag).build();
    }
}
