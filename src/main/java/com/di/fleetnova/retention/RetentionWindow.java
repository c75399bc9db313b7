package com.di.fleetnova.retention;

import com.di.fleetnova.model.Observation;

import java.util.List;

/**
 * Persisted retention layers as loaded at run start.
 *
 * @param state          {@link DayState#SAME_DAY} when today's daily partition exists
 * @param hist           historical partition
 * @param todayDaily     today's daily partition, empty on {@link DayState#NEW_DAY}
 * @param previousDaily  yesterday's daily partition, only consulted on {@link DayState#NEW_DAY}
 */
public record RetentionWindow(DayState state,
                              List<Observation> hist,
                              List<Observation> todayDaily,
                              List<Observation> previousDaily) {

    public RetentionWindow {
        if (state == null) {
            throw new IllegalArgumentException("state is required");
        }
        hist = hist != null ? List.copyOf(hist) : List.of();
        todayDaily = todayDaily != null ? List.copyOf(todayDaily) : List.of();
        previousDaily = previousDaily != null ? List.copyOf(previousDaily) : List.of();
    }

    public static RetentionWindow sameDay(List<Observation> hist, List<Observation> todayDaily) {
        return new RetentionWindow(DayState.SAME_DAY, hist, todayDaily, List.of());
    }

    public static RetentionWindow newDay(List<Observation> hist, List<Observation> previousDaily) {
        return new RetentionWindow(DayState.NEW_DAY, hist, List.of(), previousDaily);
    }
}
