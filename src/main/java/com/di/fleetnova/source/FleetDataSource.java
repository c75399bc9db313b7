package com.di.fleetnova.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Read access to the remote fleet data.
 *
 * <p>Implementations return whatever JSON body the source answered with, including
 * {@code {"detail": ...}} error bodies; shape detection happens downstream.
 */
public interface FleetDataSource {

    /**
     * @param vesselId IMO number, {@code null} for {@link ResourceKind#FLEET}
     * @throws com.di.fleetnova.exception.FetchException when no JSON body could be obtained
     */
    JsonNode fetch(String vesselId, ResourceKind kind);
}
