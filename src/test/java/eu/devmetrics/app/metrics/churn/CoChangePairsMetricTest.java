package eu.devmetrics.app.metrics.churn;

import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.metrics.HistoryFixtures;
import eu.devmetrics.app.metrics.MetricComputation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static eu.devmetrics.app.metrics.HistoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CoChangePairsMetricTest {

    private final CoChangePairsMetric metric = new CoChangePairsMetric();

    @Test
    void testCompute_jaccardCoupling() {
        // Arrange
        GitHistory history = GitHistory.builder()
                .commitStats(List.of(
                        statCommit("Ann", "2024-03-04T10:00:00Z", "A", 1, 0, "B", 1, 0),
                        statCommit("Ann", "2024-03-05T10:00:00Z", "A", 1, 0),
                        statCommit("Bob", "2024-03-06T10:00:00Z", "C", 1, 0, "B", 1, 0)))
                .build();

        // Act
        MetricComputation computation = compute(metric, input(history));
        Map<String, CoChangePair> pairs = keyed(computation);

        // Assert
        assertEquals(List.of("B <-> C", "A <-> B"), List.copyOf(pairs.keySet()));
        CoChangePair ab = pairs.get("A <-> B");
        assertEquals(1, ab.getCoChanges());
        assertEquals(2, ab.getFile1TotalChanges());
        assertEquals(2, ab.getFile2TotalChanges());
        assertEquals(0.333, ab.getCouplingStrength());
        assertEquals(50.0, ab.getCouplingPercentage());
        assertEquals(CoChangePair.CouplingCategory.MEDIUM, ab.getCouplingCategory());
        assertEquals(0.5, pairs.get("B <-> C").getCouplingStrength());
        assertEquals(2, computation.getMetadata().get("total_file_pairs"));
    }

    @Test
    void testCompute_duplicateFileInCommitCountsOnce() {
        GitHistory history = GitHistory.builder()
                .commitStats(List.of(
                        statCommit("Ann", "2024-03-04T10:00:00Z", "A", 1, 0, "B", 1, 0, "A", 2, 0)))
                .build();

        Map<String, CoChangePair> pairs = keyed(compute(metric, input(history)));

        assertEquals(1, pairs.size());
        assertEquals(1.0, pairs.get("A <-> B").getCouplingStrength());
    }

    @Test
    void testCompute_bucketCountsFollowCouplingCategory() {
        // Arrange
        GitHistory history = GitHistory.builder()
                .commitStats(List.of(
                        statCommit("Ann", "2024-03-04T10:00:00Z", "A", 1, 0, "B", 1, 0),
                        statCommit("Ann", "2024-03-05T10:00:00Z", "A", 1, 0),
                        statCommit("Ann", "2024-03-06T10:00:00Z", "A", 1, 0),
                        statCommit("Bob", "2024-03-07T10:00:00Z", "B", 1, 0),
                        statCommit("Bob", "2024-03-08T10:00:00Z", "B", 1, 0)))
                .build();

        // Act
        MetricComputation computation = compute(metric, input(history));
        CoChangePair ab = HistoryFixtures.<CoChangePair>keyed(computation).get("A <-> B");

        // Assert
        assertEquals(0.2, ab.getCouplingStrength());
        assertEquals(CoChangePair.CouplingCategory.MEDIUM, ab.getCouplingCategory());
        assertEquals(0L, computation.getMetadata().get("high_coupling_pairs"));
        assertEquals(1L, computation.getMetadata().get("medium_coupling_pairs"));
        assertEquals(0L, computation.getMetadata().get("low_coupling_pairs"));
    }

    @Test
    void testCouplingStrength_symmetricAndGuarded() {
        assertEquals(CoChangePair.couplingStrength(1, 2, 3), CoChangePair.couplingStrength(1, 3, 2));
        assertEquals(CoChangePair.key("b", "a"), CoChangePair.key("a", "b"));
        assertEquals(0.0, CoChangePair.couplingStrength(0, 0, 5));
        assertEquals(1.0, CoChangePair.couplingStrength(2, 2, 2));
    }

    @Test
    void testCouplingCategory_boundaries() {
        assertEquals(CoChangePair.CouplingCategory.HIGH, CoChangePair.CouplingCategory.of(0.51));
        assertEquals(CoChangePair.CouplingCategory.MEDIUM, CoChangePair.CouplingCategory.of(0.5));
        assertEquals(CoChangePair.CouplingCategory.MEDIUM, CoChangePair.CouplingCategory.of(0.2));
        assertEquals(CoChangePair.CouplingCategory.LOW, CoChangePair.CouplingCategory.of(0.1));
        assertEquals(CoChangePair.CouplingCategory.MINIMAL, CoChangePair.CouplingCategory.of(0.05));
    }

    @Test
    void testArchitecturalHotspots_needThreeStrongPairs() {
        List<CoChangePair> pairs = List.of(
                pair("core", "a", 0.8),
                pair("core", "b", 0.4),
                pair("c", "core", 0.31),
                pair("a", "b", 0.3),
                pair("a", "d", 0.9));

        Map<String, Integer> hotspots = CoChangePairsMetric.architecturalHotspots(pairs);

        assertEquals(Map.of("core", 3), hotspots);
    }

    @Test
    void testCompute_emptyInput() {
        MetricComputation computation = compute(metric, empty());

        assertTrue(computation.getValue().isEmpty());
        assertEquals(0, computation.getDataPoints());
    }

    private static CoChangePair pair(String file1, String file2, double strength) {
        return CoChangePair.builder().file1(file1).file2(file2).couplingStrength(strength).build();
    }
}
