package com.di.fleetnova.pipeline;

import com.di.fleetnova.storage.PartitionPaths;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Identity of one run: its start time doubles as the load date of every produced row.
 */
public record RunContext(LocalDateTime runStart, String runPartition) {

    public static RunContext startingAt(LocalDateTime runStart) {
        LocalDateTime start = runStart.truncatedTo(ChronoUnit.SECONDS);
        return new RunContext(start, PartitionPaths.runPartition(start));
    }

    public LocalDateTime loadDate() {
        return runStart;
    }

    public LocalDate runDate() {
        return runStart.toLocalDate();
    }
}
