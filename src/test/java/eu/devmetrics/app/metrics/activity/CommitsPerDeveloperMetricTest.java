package eu.devmetrics.app.metrics.activity;

import eu.devmetrics.app.git.ContributorCount;
import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static eu.devmetrics.app.metrics.HistoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CommitsPerDeveloperMetricTest {

    private final CommitsPerDeveloperMetric metric = new CommitsPerDeveloperMetric();

    @Test
    void testCompute_sortsByCountAndSumsDuplicates() {
        // Arrange
        GitHistory history = GitHistory.builder()
                .contributors(List.of(
                        ContributorCount.builder().name("Ann").email("ann@x.io").commitCount(3).build(),
                        ContributorCount.builder().name("Bob").commitCount(10).build(),
                        ContributorCount.builder().name("Cid").email("cid@x.io").commitCount(3).build(),
                        ContributorCount.builder().name("Ann").email("ann@x.io").commitCount(2).build()))
                .build();

        // Act
        MetricComputation computation = compute(metric, input(history));
        Map<String, Integer> buckets = ((MetricValue.Distribution) computation.getValue()).buckets();

        // Assert
        assertEquals(List.of("Bob", "Ann <ann@x.io>", "Cid <cid@x.io>"), List.copyOf(buckets.keySet()));
        assertEquals(5, buckets.get("Ann <ann@x.io>"));
        assertEquals(3, computation.getDataPoints());
        assertEquals(3, computation.getMetadata().get("total_contributors"));
        assertEquals(18, computation.getMetadata().get("total_commits"));
        assertEquals(6.0, computation.getMetadata().get("avg_commits_per_contributor"));
        assertEquals("Bob", computation.getMetadata().get("top_contributor"));
    }

    @Test
    void testCompute_topContributorReflectsMergedCounts() {
        // Arrange
        GitHistory history = GitHistory.builder()
                .contributors(List.of(
                        ContributorCount.builder().name("Ann").email("ann@x.io").commitCount(4).build(),
                        ContributorCount.builder().name("Bob").commitCount(5).build(),
                        ContributorCount.builder().name("Ann").email("ann@x.io").commitCount(4).build()))
                .build();

        // Act
        MetricComputation computation = compute(metric, input(history));
        Map<String, Integer> buckets = ((MetricValue.Distribution) computation.getValue()).buckets();

        // Assert
        assertEquals(Map.of("Ann <ann@x.io>", 8, "Bob", 5), buckets);
        assertEquals("Ann <ann@x.io>", computation.getMetadata().get("top_contributor"));
        assertEquals(2, computation.getMetadata().get("total_contributors"));
        assertEquals(2, computation.getDataPoints());
        assertEquals(6.5, computation.getMetadata().get("avg_commits_per_contributor"));
    }

    @Test
    void testCompute_emptyInput() {
        MetricComputation computation = compute(metric, empty());

        assertInstanceOf(MetricValue.Distribution.class, computation.getValue());
        assertTrue(computation.getValue().isEmpty());
        assertEquals(0, computation.getDataPoints());
        assertEquals("contributors", metric.getDataPointsLabel());
    }
}
