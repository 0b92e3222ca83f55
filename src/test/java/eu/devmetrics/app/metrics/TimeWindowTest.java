package eu.devmetrics.app.metrics;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.validation.MetricValidationException;
import eu.devmetrics.app.validation.MetricValidationException.ValidationErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-31T00:00:00Z");

    @Test
    void testOf_validWindow() {
        TimeWindow window = TimeWindow.of(START, END);

        assertEquals(START, window.getStart());
        assertEquals(END, window.getEnd());
        assertEquals(30, window.getDurationDays());
        assertEquals("2024-01-01 to 2024-01-31", window.toString());
    }

    @Test
    void testOf_rejectsEqualBounds() {
        MetricValidationException exception =
                assertThrows(MetricValidationException.class, () -> TimeWindow.of(START, START));

        assertEquals(ValidationErrorCode.INVALID_TIME_WINDOW, exception.getErrorCode());
    }

    @Test
    void testOf_rejectsReversedBounds() {
        assertThrows(MetricValidationException.class, () -> TimeWindow.of(END, START));
    }

    @Test
    void testOf_rejectsMissingBounds() {
        MetricValidationException exception =
                assertThrows(MetricValidationException.class, () -> TimeWindow.of(null, END));

        assertEquals(ValidationErrorCode.MISSING_TIME_WINDOW, exception.getErrorCode());
        assertThrows(MetricValidationException.class, () -> TimeWindow.of(START, null));
    }

    @Test
    void testLastDays() {
        TimeWindow window = TimeWindow.lastDays(30, END);

        assertEquals(START, window.getStart());
    }

    @Test
    void testContains_boundsInclusive() {
        TimeWindow window = TimeWindow.of(START, END);

        assertTrue(window.contains(START));
        assertTrue(window.contains(END));
        assertFalse(window.contains(END.plusSeconds(1)));
    }

    @Test
    void testAllTime_startsAtFirstCommit() {
        Commit older = HistoryFixtures.commit("Ann", "2023-06-01T08:00:00+02:00", "first");
        Commit newer = HistoryFixtures.commit("Bob", "2023-07-01T08:00:00Z", "second");

        TimeWindow window = TimeWindow.allTime(List.of(newer, older), END);

        assertEquals(Instant.parse("2023-06-01T06:00:00Z"), window.getStart());
        assertEquals(END, window.getEnd());
    }

    @Test
    void testAllTime_withoutCommitsFallsBackToOneDay() {
        TimeWindow window = TimeWindow.allTime(List.of(), END);

        assertEquals(END.minusSeconds(86_400), window.getStart());
    }

    @Test
    void testGitBounds_areIsoInstants() {
        TimeWindow window = TimeWindow.of(START, END);

        assertEquals("2024-01-01T00:00:00Z", window.getGitSince());
        assertEquals("2024-01-31T00:00:00Z", window.getGitUntil());
    }
}
