package com.di.fleetnova.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the pivoted table: all signal values of one vessel at one timestamp.
 * Missing signals are absent from {@link #values}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WideRow {

    private String              vesselId;
    private String              timestamp;
    private LocalDateTime       loadDate;

    @Builder.Default
    private Map<String, Double> values = new LinkedHashMap<>();

    public Double value(String signalId) {
        return values.get(signalId);
    }
}
