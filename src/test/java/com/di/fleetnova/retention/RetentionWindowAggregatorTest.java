package com.di.fleetnova.retention;

import com.di.fleetnova.config.PipelineContext;
import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.ObservationTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetentionWindowAggregator Tests")
class RetentionWindowAggregatorTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2024, 3, 10);
    private static final LocalDateTime NOW = RUN_DATE.atTime(9, 30);

    private final RetentionWindowAggregator aggregator =
            new RetentionWindowAggregator(new PipelineContext(Duration.ofMinutes(5), 5, null));

    private static Observation obs(String ts, LocalDateTime load, ObservationTag tag) {
        return Observation.builder()
                .vesselId("v1").signalId("rpm").timestamp(ts).value(1.0)
                .loadDate(load).friendlyName("RPM").tag(tag)
                .build();
    }

    // ============================================================================
    // Merge
    // ============================================================================

    @Test
    @DisplayName("Should publish today and new rows, dropping keys already in history")
    void testAggregate_SameDayMerge() {
        LocalDateTime earlierToday = RUN_DATE.atTime(6, 0);
        RetentionWindow window = RetentionWindow.sameDay(
                List.of(obs("t1", NOW.minusDays(2), ObservationTag.HIST)),
                List.of(obs("t2", earlierToday, ObservationTag.NEW)));
        List<Observation> current = List.of(
                obs("t1", NOW, ObservationTag.NEW),
                obs("t2", NOW, ObservationTag.NEW),
                obs("t3", NOW, ObservationTag.NEW));

        RetentionOutcome outcome = aggregator.aggregate(window, current, RUN_DATE);

        assertEquals(DayState.SAME_DAY, outcome.getState());
        List<Observation> published = outcome.getPublished();
        assertEquals(2, published.size());
        assertEquals("t2", published.get(0).getTimestamp());
        assertEquals(ObservationTag.TODAY, published.get(0).getTag());
        assertEquals(earlierToday, published.get(0).getLoadDate());
        assertEquals("t3", published.get(1).getTimestamp());
        assertEquals(ObservationTag.NEW, published.get(1).getTag());
        assertFalse(outcome.isHistChanged());
    }

    @Test
    @DisplayName("Should treat differing friendly names as distinct observations")
    void testAggregate_FriendlyNameInKey() {
        Observation named = obs("t1", NOW, ObservationTag.NEW);
        Observation renamed = named.toBuilder().friendlyName("Engine speed").build();

        RetentionOutcome outcome = aggregator.aggregate(
                RetentionWindow.sameDay(List.of(), List.of()), List.of(named, renamed), RUN_DATE);

        assertEquals(2, outcome.getPublished().size());
    }

    @Test
    @DisplayName("Should give the same summary when merged twice on the same input")
    void testAggregate_Idempotent() {
        RetentionWindow window = RetentionWindow.sameDay(
                List.of(obs("t1", NOW.minusDays(1), ObservationTag.HIST)),
                List.of(obs("t2", NOW.minusHours(2), ObservationTag.TODAY),
                        obs("t2", NOW.minusHours(1), ObservationTag.TODAY)));
        List<Observation> current = List.of(obs("t2", NOW, ObservationTag.NEW), obs("t4", NOW, ObservationTag.NEW));

        RetentionOutcome first = aggregator.aggregate(window, current, RUN_DATE);
        RetentionOutcome second = aggregator.aggregate(window, current, RUN_DATE);

        assertEquals(first.getPublished(), second.getPublished());
        assertEquals(first.getHist(), second.getHist());

        List<Observation> republished = RetentionWindowAggregator.publish(
                first.getHist(), first.getPublished(), List.of());
        assertEquals(first.getPublished(), republished);
    }

    // ============================================================================
    // Day rollover
    // ============================================================================

    @Test
    @DisplayName("Should fold yesterday's daily rows into history on a new day")
    void testAggregate_DayRollover() {
        LocalDateTime yesterday = NOW.minusDays(1);
        RetentionWindow window = RetentionWindow.newDay(
                List.of(),
                List.of(obs("y1", yesterday, ObservationTag.TODAY), obs("y2", yesterday, ObservationTag.NEW)));
        List<Observation> current = List.of(obs("y2", NOW, ObservationTag.NEW), obs("n1", NOW, ObservationTag.NEW));

        RetentionOutcome outcome = aggregator.aggregate(window, current, RUN_DATE);

        assertEquals(DayState.NEW_DAY, outcome.getState());
        assertTrue(outcome.isHistChanged());
        assertEquals(2, outcome.getFoldedRows());
        assertEquals(2, outcome.getHist().size());
        assertTrue(outcome.getHist().stream().allMatch(o -> o.getTag() == ObservationTag.HIST));

        assertEquals(1, outcome.getPublished().size());
        assertEquals("n1", outcome.getPublished().get(0).getTimestamp());
        assertTrue(outcome.getPublished().stream().noneMatch(o -> o.getLoadDate().equals(yesterday)));
    }

    @Test
    @DisplayName("Should start a new day with an empty daily layer")
    void testAggregate_NewDayIgnoresTodayDaily() {
        RetentionWindow window = new RetentionWindow(DayState.NEW_DAY, List.of(),
                List.of(obs("stale", NOW, ObservationTag.TODAY)), List.of());

        RetentionOutcome outcome = aggregator.aggregate(window, List.of(), RUN_DATE);

        assertTrue(outcome.getPublished().isEmpty());
    }

    // ============================================================================
    // Pruning
    // ============================================================================

    @Test
    @DisplayName("Should exclude history rows exactly history-days old and keep younger ones")
    void testPrune_Boundary() {
        List<Observation> hist = List.of(
                obs("a", RUN_DATE.minusDays(5).atTime(23, 59), ObservationTag.HIST),
                obs("b", RUN_DATE.minusDays(4).atStartOfDay(), ObservationTag.HIST),
                obs("c", RUN_DATE.minusDays(1).atTime(12, 0), ObservationTag.HIST),
                obs("d", RUN_DATE.atTime(1, 0), ObservationTag.HIST),
                obs("e", null, ObservationTag.HIST));

        List<Observation> kept = aggregator.prune(hist, RUN_DATE);

        assertEquals(List.of("b", "c"), kept.stream().map(Observation::getTimestamp).toList());
    }

    @Test
    @DisplayName("Should report pruning as a history change on the same day")
    void testAggregate_PruneMarksHistChanged() {
        RetentionWindow window = RetentionWindow.sameDay(
                List.of(obs("old", NOW.minusDays(30), ObservationTag.HIST)), List.of());

        RetentionOutcome outcome = aggregator.aggregate(window, List.of(), RUN_DATE);

        assertEquals(1, outcome.getPrunedRows());
        assertTrue(outcome.getHist().isEmpty());
        assertTrue(outcome.isHistChanged());
    }
}
