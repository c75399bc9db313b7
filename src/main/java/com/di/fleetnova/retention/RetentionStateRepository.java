package com.di.fleetnova.retention;

import com.di.fleetnova.model.Observation;
import com.di.fleetnova.storage.LocalFileStore;
import com.di.fleetnova.storage.PartitionPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Loads and stores the retention layers: history under {@code latest/ref_data}, the
 * published summary under {@code daily_summary/yyyyMMdd/summary}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionStateRepository {

    static final String HIST_TABLE    = "ref_data";
    static final String SUMMARY_TABLE = "summary";

    private final LocalFileStore store;
    private final PartitionPaths paths;

    public RetentionWindow load(LocalDate runDate) {
        List<Observation> hist = store.readTable(HIST_TABLE, paths.latest(), Observation.class);
        Path today = paths.dailySummary(runDate);
        if (store.tableExists(SUMMARY_TABLE, today)) {
            List<Observation> daily = store.readTable(SUMMARY_TABLE, today, Observation.class);
            log.info("[RETENTION] Same day: hist={} daily={}", hist.size(), daily.size());
            return RetentionWindow.sameDay(hist, daily);
        }
        List<Observation> previous = store.readTable(SUMMARY_TABLE, paths.dailySummary(runDate.minusDays(1)),
                Observation.class);
        log.info("[RETENTION] New day: hist={} previousDaily={}", hist.size(), previous.size());
        return RetentionWindow.newDay(hist, previous);
    }

    public void save(RetentionOutcome outcome, LocalDate runDate) {
        if (outcome.isHistChanged()) {
            store.writeTable(outcome.getHist(), HIST_TABLE, paths.latest());
        }
        store.writeTable(outcome.getPublished(), SUMMARY_TABLE, paths.dailySummary(runDate));
    }
}
