package com.di.fleetnova.retention;

import com.di.fleetnova.config.PipelineContext;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.ObservationKey;
import com.di.fleetnova.model.ObservationTag;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the historical, daily and current layers into the run's summary.
 *
 * <p>On {@link DayState#NEW_DAY} yesterday's daily rows are re-tagged {@code hist} and
 * appended to history; on {@link DayState#SAME_DAY} today's daily rows are tagged
 * {@code today}. History is then pruned to load dates strictly after
 * {@code runDate - historyDays} and before {@code runDate}. The layers are concatenated
 * hist, daily, current and deduplicated keep-first on {@link Observation#dedupKey()};
 * only {@code new} and {@code today} rows are published.
 *
 * <p>Stateless: all persisted state comes in through {@link RetentionWindow} and goes
 * out through {@link RetentionOutcome}.
 */
@Slf4j
public class RetentionWindowAggregator {

    private final int historyDays;

    public RetentionWindowAggregator(PipelineContext context) {
        this.historyDays = context.historyDays();
    }

    public RetentionOutcome aggregate(RetentionWindow window, List<Observation> current, LocalDate runDate) {
        List<Observation> hist = new ArrayList<>(window.hist());
        List<Observation> daily;
        int folded = 0;

        if (window.state() == DayState.NEW_DAY) {
            for (Observation obs : window.previousDaily()) {
                hist.add(obs.withTag(ObservationTag.HIST));
                folded++;
            }
            daily = List.of();
            log.info("[RETENTION] New day {}: folded {} row(s) of the previous day into history", runDate, folded);
        } else {
            daily = retag(window.todayDaily(), ObservationTag.TODAY);
        }

        List<Observation> pruned = prune(hist, runDate);
        int prunedRows = hist.size() - pruned.size();

        List<Observation> published = publish(pruned, daily, retag(current, ObservationTag.NEW));
        log.info("[RETENTION] state={} hist={} (pruned {}) daily={} current={} published={}",
                window.state(), pruned.size(), prunedRows, daily.size(),
                current != null ? current.size() : 0, published.size());

        return RetentionOutcome.builder()
                .state(window.state())
                .hist(pruned)
                .published(published)
                .foldedRows(folded)
                .prunedRows(prunedRows)
                .build();
    }

    /**
     * History rows whose load date lies in {@code (runDate - historyDays, runDate)}.
     * Rows without a load date are dropped.
     */
    public List<Observation> prune(List<Observation> hist, LocalDate runDate) {
        LocalDate lowerExclusive = runDate.minusDays(historyDays);
        List<Observation> kept = new ArrayList<>(hist.size());
        for (Observation obs : hist) {
            if (obs.getLoadDate() == null) continue;
            LocalDate day = obs.getLoadDate().toLocalDate();
            if (day.isAfter(lowerExclusive) && day.isBefore(runDate)) {
                kept.add(obs);
            }
        }
        return kept;
    }

    /**
     * Keep-first dedup over {@code hist + daily + current}, filtered to published tags.
     */
    public static List<Observation> publish(List<Observation> hist, List<Observation> daily, List<Observation> current) {
        Map<ObservationKey, Observation> merged = new LinkedHashMap<>();
        for (List<Observation> layer : List.of(hist, daily, current)) {
            for (Observation obs : layer) {
                merged.putIfAbsent(obs.dedupKey(), obs);
            }
        }
        List<Observation> out = new ArrayList<>();
        for (Observation obs : merged.values()) {
            if (obs.getTag() != null && obs.getTag().isPublished()) {
                out.add(obs);
            }
        }
        return out;
    }

    private static List<Observation> retag(List<Observation> rows, ObservationTag tag) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        List<Observation> out = new ArrayList<>(rows.size());
        for (Observation obs : rows) {
            out.add(obs.getTag() == tag ? obs : obs.withTag(tag));
        }
        return out;
    }
}
