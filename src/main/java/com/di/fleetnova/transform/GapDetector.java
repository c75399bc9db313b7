package com.di.fleetnova.transform;

import com.di.fleetnova.config.PipelineContext;
import com.di.fleetnova.exception.MalformedTimestampException;
import com.di.fleetnova.model.GapInterval;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges null observations into contiguous gap intervals per (vessel, signal).
 *
 * <p>Timestamps of one group are sorted; consecutive timestamps further apart than
 * the merge threshold close the current interval {@code [start, previous]} and
 * open a new one. A group whose timestamps cannot be parsed is skipped and logged;
 * other groups are unaffected.
 */
@Slf4j
public class GapDetector {

    private final Duration mergeThreshold;

    public GapDetector(PipelineContext context) {
        this.mergeThreshold = context.gapMergeThreshold();
    }

    /**
     * @param nullStream null observations of any number of vessels and signals
     * @return intervals grouped by (vessel, signal) in first-seen order, sorted by start within a group
     */
    public List<GapInterval> detect(Collection<Observation> nullStream) {
        if (nullStream == null || nullStream.isEmpty()) {
            return List.of();
        }
        Map<List<String>, List<Observation>> groups = new LinkedHashMap<>();
        for (Observation obs : nullStream) {
            groups.computeIfAbsent(List.of(nullSafe(obs.getVesselId()), nullSafe(obs.getSignalId())),
                    k -> new ArrayList<>()).add(obs);
        }

        List<GapInterval> out = new ArrayList<>();
        int skipped = 0;
        for (Map.Entry<List<String>, List<Observation>> group : groups.entrySet()) {
            String vesselId = group.getKey().get(0);
            String signalId = group.getKey().get(1);
            try {
                out.addAll(detectGroup(vesselId, signalId, group.getValue()));
            } catch (MalformedTimestampException e) {
                skipped++;
                log.warn("[GAPS] vessel={} signal={} skipped: {}", vesselId, signalId, e.getMessage());
            }
        }
        log.debug("[GAPS] {} group(s) → {} interval(s), {} group(s) skipped", groups.size(), out.size(), skipped);
        return out;
    }

    /**
     * Gap intervals of a single (vessel, signal) group.
     *
     * @throws MalformedTimestampException when any timestamp of the group is unparseable
     */
    public List<GapInterval> detectGroup(String vesselId, String signalId, List<Observation> nulls) {
        if (nulls.isEmpty()) {
            return List.of();
        }
        List<Instant> times = new ArrayList<>(nulls.size());
        LocalDateTime loadDate = null;
        for (Observation obs : nulls) {
            times.add(TimestampParser.parse(obs.getTimestamp()));
            if (obs.getLoadDate() != null && (loadDate == null || obs.getLoadDate().isAfter(loadDate))) {
                loadDate = obs.getLoadDate();
            }
        }
        times.sort(null);

        List<GapInterval> intervals = new ArrayList<>();
        Instant gapStart = times.get(0);
        Instant prev = gapStart;
        for (int i = 1; i < times.size(); i++) {
            Instant t = times.get(i);
            if (Duration.between(prev, t).compareTo(mergeThreshold) > 0) {
                intervals.add(interval(vesselId, signalId, gapStart, prev, loadDate));
                gapStart = t;
            }
            prev = t;
        }
        intervals.add(interval(vesselId, signalId, gapStart, prev, loadDate));
        return intervals;
    }

    private static GapInterval interval(String vesselId, String signalId, Instant start, Instant end,
                                        LocalDateTime loadDate) {
        return GapInterval.builder()
                .vesselId(vesselId)
                .signalId(signalId)
                .gapStart(start)
                .gapEnd(end)
                .loadDate(loadDate)
                .build();
    }

    private static String nullSafe(String s) {
        return s != null ? s : "";
    }
}
