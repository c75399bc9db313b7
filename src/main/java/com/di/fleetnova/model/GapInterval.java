package com.di.fleetnova.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Contiguous span of missing observations for one (vessel, signal) pair.
 * Both ends are inclusive; a single missing sample gives {@code gapStart == gapEnd}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GapInterval {

    private String        vesselId;
    private String        signalId;
    private Instant       gapStart;
    private Instant       gapEnd;
    private LocalDateTime loadDate;
}
