package eu.devmetrics.app.metrics.flow;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.git.ProductionTagMatcher;
import eu.devmetrics.app.git.Tag;
import eu.devmetrics.app.metrics.MetricComputation;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static eu.devmetrics.app.metrics.HistoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LeadTimeMetricTest {

    private final LeadTimeMetric metric = new LeadTimeMetric(ProductionTagMatcher.withDefaults());

    @Test
    void testCompute_usesEarliestReleaseAfterCommit() {
        // Arrange
        GitHistory history = GitHistory.builder()
                .commits(List.of(commit("Ann", "2024-03-04T10:00:00Z", "Add endpoint")))
                .tags(List.of(
                        tag("v1.1.0", "2024-03-06T12:00:00Z"),
                        tag("v1.0.0", "2024-03-04T11:00:00Z"),
                        tag("v0.9.0", "2024-03-01T00:00:00Z")))
                .build();

        // Act
        MetricComputation computation = compute(metric, input(history));
        LeadTimeStats stats = summary(computation);

        // Assert
        assertEquals(1, stats.getOverall().getCommitsWithLeadTime());
        assertEquals(1.0, stats.getOverall().getAvgLeadTimeHours());
        assertEquals(1.0, stats.getOverall().getMedianLeadTimeHours());
        assertEquals(1.0, stats.getOverall().getFlowEfficiency());
        assertEquals(List.of("v1.1.0", "v1.0.0", "v0.9.0"),
                stats.getProductionReleases().stream().map(Tag::getName).collect(Collectors.toList()));
        assertEquals(1, computation.getDataPoints());
    }

    @Test
    void testCommitLeadTimes_excludesCommitsWithoutLaterRelease() {
        Commit released = commit("Ann", "2024-03-04T10:00:00Z", "One");
        Commit unreleased = commit("Bob", "2024-03-10T10:00:00Z", "Two");
        List<Tag> releases = List.of(tag("v1.0.0", "2024-03-05T10:00:00Z"));

        List<CommitLeadTime> leadTimes = LeadTimeMetric.commitLeadTimes(List.of(released, unreleased), releases);

        assertEquals(1, leadTimes.size());
        assertEquals(24.0, leadTimes.get(0).getLeadTimeHours());
        assertEquals(1.0, leadTimes.get(0).getLeadTimeDays());
        assertEquals("v1.0.0", leadTimes.get(0).getDeployedInRelease());
    }

    @Test
    void testCommitLeadTimes_tagAtSameInstantDoesNotCount() {
        Commit commit = commit("Ann", "2024-03-04T10:00:00Z", "One");

        assertTrue(LeadTimeMetric.commitLeadTimes(List.of(commit),
                List.of(tag("v1.0.0", "2024-03-04T10:00:00Z"))).isEmpty());
    }

    @Test
    void testCompute_ignoresNonProductionAndUndatedTags() {
        GitHistory history = GitHistory.builder()
                .commits(List.of(commit("Ann", "2024-03-04T10:00:00Z", "Add endpoint")))
                .tags(List.of(tag("nightly", "2024-03-04T11:00:00Z"), tag("v2.0.0", null)))
                .build();

        LeadTimeStats stats = summary(compute(metric, input(history)));

        assertEquals(0, stats.getOverall().getCommitsWithLeadTime());
        assertEquals(1.0, stats.getOverall().getFlowEfficiency());
        assertNull(stats.getDistribution());
        assertNull(stats.getBottlenecks());
        assertTrue(stats.getByAuthor().isEmpty());
    }

    @Test
    void testCompute_authorStatsCountAllCommits() {
        GitHistory history = GitHistory.builder()
                .commits(List.of(
                        commit("Ann", "2024-03-04T10:00:00Z", "One"),
                        commit("Ann", "2024-03-08T10:00:00Z", "Two")))
                .tags(List.of(tag("v1.0.0", "2024-03-04T12:00:00Z")))
                .build();

        LeadTimeStats stats = summary(compute(metric, input(history)));
        LeadTimeStats.AuthorLeadTime ann = stats.getByAuthor().get("Ann");

        assertEquals(2, ann.getTotalCommits());
        assertEquals(1, ann.getCommitsDeployed());
        assertEquals(50.0, ann.getDeploymentRate());
    }

    @Test
    void testCategorize_boundaries() {
        Map<String, Integer> categories = LeadTimeMetric.categorize(List.of(4.0, 24.0, 168.0, 672.0, 673.0));

        assertEquals(Map.of("very_fast", 1, "fast", 1, "moderate", 1, "slow", 1, "very_slow", 1), categories);
    }

    @Test
    void testOutliers_iqrRule() {
        assertEquals(List.of(), LeadTimeMetric.outliers(List.of(1.0, 2.0, 100.0)));
        assertEquals(List.of(100.0), LeadTimeMetric.outliers(List.of(1.0, 2.0, 2.0, 3.0, 3.0, 4.0, 100.0)));
    }

    @Test
    void testFlowEfficiency_shareWithinOneWeek() {
        assertEquals(1.0, LeadTimeMetric.flowEfficiency(List.of()));
        assertEquals(0.667, LeadTimeMetric.flowEfficiency(List.of(1.0, 168.0, 169.0)));
    }

    @Test
    void testTrends_requireTenLeadTimes() {
        List<CommitLeadTime> nine = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            nine.add(CommitLeadTime.builder()
                    .commitDate(OffsetDateTime.parse("2024-01-01T00:00:00Z").plusMonths(i))
                    .leadTimeHours(10)
                    .build());
        }
        assertNull(LeadTimeMetric.trends(nine));
    }

    @Test
    void testTrendDirection() {
        assertEquals("improving", LeadTimeMetric.trendDirection(List.of(100.0, 100.0, 50.0, 50.0)));
        assertEquals("deteriorating", LeadTimeMetric.trendDirection(List.of(10.0, 30.0)));
        assertEquals("stable", LeadTimeMetric.trendDirection(List.of(10.0, 10.5)));
    }

    @Test
    void testCompute_emptyInput() {
        MetricComputation computation = compute(metric, empty());

        assertTrue(computation.getValue().isEmpty());
        assertEquals(0, computation.getDataPoints());
    }
}
