package com.di.fleetnova.pipeline;

import com.di.fleetnova.model.GapInterval;
import com.di.fleetnova.model.Observation;

import java.util.List;

/**
 * Per-vessel output of the timeseries stage.
 *
 * @param observations enriched observations with a value
 * @param gaps         gap intervals derived from the null observations
 */
public record VesselTimeseries(String vesselId, List<Observation> observations, List<GapInterval> gaps) {

    public VesselTimeseries {
        observations = observations != null ? List.copyOf(observations) : List.of();
        gaps = gaps != null ? List.copyOf(gaps) : List.of();
    }

    public static VesselTimeseries empty(String vesselId) {
        return new VesselTimeseries(vesselId, List.of(), List.of());
    }
}
