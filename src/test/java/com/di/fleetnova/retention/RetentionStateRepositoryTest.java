package com.di.fleetnova.retention;

import com.di.fleetnova.config.FleetPipelineProperties;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.ObservationTag;
import com.di.fleetnova.storage.LocalFileStore;
import com.di.fleetnova.storage.PartitionPaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetentionStateRepository Tests")
class RetentionStateRepositoryTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 10);

    @TempDir
    Path root;

    private LocalFileStore store;
    private PartitionPaths paths;
    private RetentionStateRepository repository;

    @BeforeEach
    void setUp() {
        FleetPipelineProperties props = new FleetPipelineProperties();
        props.setDataRoot(root.toString());
        store = new LocalFileStore();
        paths = new PartitionPaths(props);
        repository = new RetentionStateRepository(store, paths);
    }

    private static Observation obs(String ts, LocalDate day, ObservationTag tag) {
        return Observation.builder().vesselId("v").signalId("s").timestamp(ts).value(1.0)
                .loadDate(day.atTime(8, 0)).tag(tag).build();
    }

    @Test
    @DisplayName("Should detect a new day when no summary exists for today")
    void testLoad_NewDay() {
        store.writeTable(List.of(obs("y", DAY.minusDays(1), ObservationTag.NEW)),
                RetentionStateRepository.SUMMARY_TABLE, paths.dailySummary(DAY.minusDays(1)));

        RetentionWindow window = repository.load(DAY);

        assertEquals(DayState.NEW_DAY, window.state());
        assertEquals(1, window.previousDaily().size());
        assertTrue(window.todayDaily().isEmpty());
        assertTrue(window.hist().isEmpty());
    }

    @Test
    @DisplayName("Should detect the same day when today's summary exists")
    void testLoad_SameDay() {
        store.writeTable(List.of(), RetentionStateRepository.SUMMARY_TABLE, paths.dailySummary(DAY));

        assertEquals(DayState.SAME_DAY, repository.load(DAY).state());
    }

    @Test
    @DisplayName("Should persist history only when it changed and always write the summary")
    void testSave() {
        RetentionOutcome unchanged = RetentionOutcome.builder()
                .state(DayState.SAME_DAY)
                .hist(List.of(obs("h", DAY.minusDays(2), ObservationTag.HIST)))
                .published(List.of(obs("n", DAY, ObservationTag.NEW)))
                .build();
        repository.save(unchanged, DAY);

        assertFalse(Files.exists(LocalFileStore.tablePath(RetentionStateRepository.HIST_TABLE, paths.latest())));
        assertEquals(1, store.readTable(RetentionStateRepository.SUMMARY_TABLE, paths.dailySummary(DAY),
                Observation.class).size());

        RetentionOutcome rolled = unchanged.toBuilder().state(DayState.NEW_DAY).build();
        repository.save(rolled, DAY);

        List<Observation> hist = repository.load(DAY).hist();
        assertEquals(1, hist.size());
        assertEquals(ObservationTag.HIST, hist.get(0).getTag());
    }
}
