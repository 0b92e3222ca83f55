package eu.devmetrics.app.metrics;

import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.git.GitHistoryCollector;
import eu.devmetrics.app.git.RepositoryRef;
import eu.devmetrics.app.validation.MetricValidationException;
import eu.devmetrics.app.validation.MetricValidationException.ValidationErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static eu.devmetrics.app.metrics.HistoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricsAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-30T12:00:00Z");

    @Mock
    private GitHistoryCollector collector;

    @TempDir
    Path workTree;

    private RepositoryRef repository;
    private MetricsAnalysisService service;
    private GitHistory history;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectory(workTree.resolve(".git"));
        repository = RepositoryRef.of("sample", workTree);

        MetricRegistry registry = new MetricRegistry(List.of(
                StubMetric.commitCounter("commit_count"),
                StubMetric.failing("broken")));
        service = new MetricsAnalysisService(
                collector,
                new CommitFilter(List.of("[bot]")),
                new MetricRunner(registry),
                registry,
                30,
                Clock.fixed(NOW, ZoneOffset.UTC));

        history = GitHistory.builder()
                .commits(List.of(
                        commit("Ann", "2024-02-01T09:00:00Z", "Add a"),
                        commit("renovate[bot]", "2024-03-01T09:00:00Z", "Bump b")))
                .build();
    }

    @Test
    void testAnalyze_runsEveryRegisteredMetricExceptExcluded() {
        // Arrange
        when(collector.collect(repository, WINDOW)).thenReturn(history);
        AnalysisOptions options = AnalysisOptions.builder().excludedMetric("broken").build();

        // Act
        AnalysisReport report = service.analyze(repository, WINDOW, options, List.of());

        // Assert
        assertEquals(List.of("commit_count"), names(report));
        assertEquals(new MetricValue.Scalar(2), report.getResults().get(0).getValue());
        assertEquals(0, report.getFailed());
    }

    @Test
    void testAnalyze_appliesCommitFilterBeforeMetrics() {
        when(collector.collect(repository, WINDOW)).thenReturn(history);
        AnalysisOptions options = AnalysisOptions.builder().excludeBots(true).build();

        AnalysisReport report = service.analyze(repository, WINDOW, options, List.of("commit_count", "broken"));

        assertEquals(List.of("commit_count", "broken"), names(report));
        assertEquals(new MetricValue.Scalar(1), report.getResult("commit_count").orElseThrow().getValue());
        assertTrue(report.getResult("broken").orElseThrow().isFailed());
    }

    @Test
    void testAnalyze_rejectsDirectoryWithoutGit(@TempDir Path plainDirectory) {
        RepositoryRef notARepository = RepositoryRef.of("plain", plainDirectory);

        MetricValidationException exception = assertThrows(MetricValidationException.class,
                () -> service.analyze(notARepository, WINDOW, AnalysisOptions.defaults(), List.of()));

        assertEquals(ValidationErrorCode.INVALID_REPOSITORY, exception.getErrorCode());
        verifyNoInteractions(collector);
    }

    @Test
    void testAnalyze_rejectsMissingWindow() {
        MetricValidationException exception = assertThrows(MetricValidationException.class,
                () -> service.analyze(repository, null, AnalysisOptions.defaults(), List.of()));

        assertEquals(ValidationErrorCode.MISSING_TIME_WINDOW, exception.getErrorCode());
        verifyNoInteractions(collector);
    }

    @Test
    void testAnalyzeRecent_usesConfiguredNumberOfDays() {
        when(collector.collect(eq(repository), any(TimeWindow.class))).thenReturn(GitHistory.empty());

        service.analyzeRecent(repository, AnalysisOptions.defaults(), List.of("commit_count"));

        ArgumentCaptor<TimeWindow> window = ArgumentCaptor.forClass(TimeWindow.class);
        verify(collector).collect(eq(repository), window.capture());
        assertEquals(NOW, window.getValue().getEnd());
        assertEquals(Instant.parse("2024-05-31T12:00:00Z"), window.getValue().getStart());
    }

    @Test
    void testAnalyzeAllTime_windowStartsAtFirstCommit() {
        when(collector.collect(eq(repository), any(TimeWindow.class))).thenReturn(history);

        AnalysisReport report = service.analyzeAllTime(repository, AnalysisOptions.defaults(), List.of("commit_count"));

        TimeWindow window = report.getResults().get(0).getTimeWindow();
        assertEquals(Instant.parse("2024-02-01T09:00:00Z"), window.getStart());
        assertEquals(NOW, window.getEnd());
    }

    private static List<String> names(AnalysisReport report) {
        return report.getResults().stream().map(MetricResult::getMetricName).collect(Collectors.toList());
    }
}
