package com.di.fleetnova.model;

/**
 * Dedup identity of an observation. The friendly name is part of the key, so two
 * catalog mappings of the same raw signal are distinct observations.
 */
public record ObservationKey(String vesselId, String signalId, String timestamp, String friendlyName) {
}
