package eu.devmetrics.app.metrics.activity;

import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricValue;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static eu.devmetrics.app.metrics.HistoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CommitFrequencyMetricTest {

    private final CommitFrequencyMetric metric = new CommitFrequencyMetric();

    private MetricComputation computeSample() {
        GitHistory history = GitHistory.builder()
                .commits(List.of(
                        commit("Ann", "2024-03-04T10:00:00Z", "one"),
                        commit("Ann", "2024-03-04T10:30:00Z", "two"),
                        commit("Bob", "2024-03-05T20:00:00Z", "three"),
                        commit("Bob", "2024-03-09T11:00:00Z", "four")))
                .build();
        return compute(metric, input(history));
    }

    @Test
    void testCompute_bucketsByDayHourAndWeekday() {
        // Act
        MetricComputation computation = computeSample();
        CommitFrequencyStats stats = summary(computation);

        // Assert
        assertEquals(4, computation.getDataPoints());
        assertEquals(4, stats.getTotalCommits());
        assertEquals(Map.of("2024-03-04", 2, "2024-03-05", 1, "2024-03-09", 1), stats.getCommitsPerDay().getByDate());
        assertEquals(2, stats.getCommitsPerDay().getMax());
        assertEquals(1, stats.getCommitsPerDay().getMin());
        assertEquals(24, stats.getCommitsPerHour().size());
        assertEquals(2, stats.getCommitsPerHour().get(10));
        assertEquals(0, stats.getCommitsPerHour().get(0));
        assertEquals(2, stats.getCommitsPerWeekday().get("Monday"));
        assertEquals(1, stats.getCommitsPerWeekday().get("Saturday"));
    }

    @Test
    void testCompute_busiestDayHourAndWorkingHours() {
        CommitFrequencyStats stats = summary(computeSample());

        assertEquals("2024-03-04", stats.getBusiestDay().getDate());
        assertEquals(2, stats.getBusiestDay().getCommits());
        assertEquals("10:00", stats.getBusiestHour());
        assertEquals(2, stats.getWorkingHours().getWorkingHours());
        assertEquals(2, stats.getWorkingHours().getOffHours());
        assertEquals(50.0, stats.getWorkingHours().getWorkingHoursPercentage());
    }

    @Test
    void testCompute_consistencyAndMetadata() {
        MetricComputation computation = computeSample();
        CommitFrequencyStats stats = summary(computation);

        assertEquals(82.3, stats.getConsistencyScore(), 0.001);
        assertEquals(5.0, computation.getMetadata().get("time_span_days"));
        assertEquals(OffsetDateTime.parse("2024-03-04T10:00:00Z"), computation.getMetadata().get("first_commit"));
    }

    @Test
    void testConsistencyScore_singleDayIsPerfect() {
        assertEquals(100.0, CommitFrequencyMetric.consistencyScore(Map.of("2024-03-04", 7)));
        assertEquals(0.0, CommitFrequencyMetric.consistencyScore(Map.of()));
    }

    @Test
    void testIsWorkingHours_boundaries() {
        assertTrue(CommitFrequencyMetric.isWorkingHours(OffsetDateTime.parse("2024-03-04T09:00:00Z")));
        assertTrue(CommitFrequencyMetric.isWorkingHours(OffsetDateTime.parse("2024-03-04T17:59:00Z")));
        assertFalse(CommitFrequencyMetric.isWorkingHours(OffsetDateTime.parse("2024-03-04T18:00:00Z")));
        assertFalse(CommitFrequencyMetric.isWorkingHours(OffsetDateTime.parse("2024-03-10T12:00:00Z")));
    }

    @Test
    void testCompute_emptyInput() {
        MetricComputation computation = compute(metric, empty());

        assertTrue(computation.getValue().isEmpty());
        assertInstanceOf(MetricValue.Summary.class, computation.getValue());
        assertEquals(0, computation.getDataPoints());
    }
}
