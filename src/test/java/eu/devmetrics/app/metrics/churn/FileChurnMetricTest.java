package eu.devmetrics.app.metrics.churn;

import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static eu.devmetrics.app.metrics.HistoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FileChurnMetricTest {

    private final FileChurnMetric metric = new FileChurnMetric();

    @SuppressWarnings("unchecked")
    private static List<FileChurnStats> rows(MetricComputation computation) {
        return ((MetricValue.Table<FileChurnStats>) computation.getValue()).rows();
    }

    @Test
    void testCompute_sortedByTotalChurnWithStableTies() {
        // Arrange
        GitHistory history = GitHistory.builder()
                .commitStats(List.of(
                        statCommit("Ann", "2024-03-04T10:00:00Z", "a.txt", 10, 5, "b.txt", 1, 1),
                        statCommit("Bob", "2024-03-05T10:00:00Z", "a.txt", 5, 0, "c.txt", 300, 200),
                        statCommit("Ann", "2024-03-06T10:00:00Z", "c.txt", 1000, 100, "d.txt", 1, 1)))
                .build();

        // Act
        MetricComputation computation = compute(metric, input(history));
        List<FileChurnStats> rows = rows(computation);

        // Assert
        assertEquals(List.of("c.txt", "a.txt", "b.txt", "d.txt"),
                rows.stream().map(FileChurnStats::getFilename).collect(Collectors.toList()));
        for (int i = 1; i < rows.size(); i++) {
            assertTrue(rows.get(i - 1).getTotalChurn() >= rows.get(i).getTotalChurn());
        }
    }

    @Test
    void testCompute_perFileFigures() {
        GitHistory history = GitHistory.builder()
                .commitStats(List.of(
                        statCommit("Bob", "2024-03-05T10:00:00Z", "c.txt", 300, 200),
                        statCommit("Ann", "2024-03-06T10:00:00Z", "c.txt", 1000, 100, "d.txt", 0, 0)))
                .build();

        MetricComputation computation = compute(metric, input(history));
        FileChurnStats top = rows(computation).get(0);
        FileChurnStats untouched = rows(computation).get(1);

        assertEquals(1600, top.getTotalChurn());
        assertEquals(1000, top.getNetChanges());
        assertEquals(2, top.getCommits());
        assertEquals(List.of("Bob", "Ann"), top.getAuthors());
        assertEquals(800.0, top.getAvgChurnPerCommit());
        assertEquals(18.8, top.getChurnRatio());
        assertEquals(0.0, untouched.getChurnRatio());
        assertEquals(1L, computation.getMetadata().get("high_churn_files"));
        assertEquals(50.0, computation.getMetadata().get("hotspot_percentage"));
    }

    @Test
    void testCompute_emptyInput() {
        MetricComputation computation = compute(metric, empty());

        assertTrue(rows(computation).isEmpty());
        assertEquals(0, computation.getDataPoints());
    }
}
