package com.di.fleetnova.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One flattened row of a "signals" payload: the definition of one signal of one
 * vessel with nested sub-fields lifted into {@link #attributes}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRecord {

    private String              vesselId;
    private String              signalId;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    private LocalDateTime       loadDate;
}
