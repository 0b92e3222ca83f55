package eu.devmetrics.app.metrics;

import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.git.GitHistoryCollector;
import eu.devmetrics.app.git.RepositoryRef;
import eu.devmetrics.app.validation.MetricValidationException;
import eu.devmetrics.app.validation.MetricValidationException.ValidationErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service analysing one repository: validates the request, collects and
 * filters the history, then runs the requested metrics.
 */
@Slf4j
@Service
public class MetricsAnalysisService {

    private final GitHistoryCollector collector;
    private final CommitFilter commitFilter;
    private final MetricRunner runner;
    private final MetricRegistry registry;
    private final int defaultWindowDays;
    private final Clock clock;

    public MetricsAnalysisService(GitHistoryCollector collector,
                                  CommitFilter commitFilter,
                                  MetricRunner runner,
                                  MetricRegistry registry,
                                  @Value("${devmetrics.default-window-days:30}") int defaultWindowDays,
                                  Clock clock) {
        this.collector = collector;
        this.commitFilter = commitFilter;
        this.runner = runner;
        this.registry = registry;
        this.defaultWindowDays = defaultWindowDays;
        this.clock = clock;
    }

    /**
     * Analyse the repository over the window.
     *
     * @param metricNames Metrics to run in order; empty runs every registered metric
     *                    not excluded by the options
     * @throws MetricValidationException if the repository or window is invalid
     */
    public AnalysisReport analyze(RepositoryRef repository, TimeWindow window,
                                  AnalysisOptions options, List<String> metricNames) {
        validate(repository, window);
        GitHistory history = collector.collect(repository, window);
        return run(repository, window, history, options, metricNames);
    }

    /**
     * Analyse the configured number of days up to now.
     */
    public AnalysisReport analyzeRecent(RepositoryRef repository, AnalysisOptions options, List<String> metricNames) {
        return analyze(repository, TimeWindow.lastDays(defaultWindowDays, clock.instant()), options, metricNames);
    }

    /**
     * Analyse the whole history: the window starts at the first commit.
     */
    public AnalysisReport analyzeAllTime(RepositoryRef repository, AnalysisOptions options, List<String> metricNames) {
        Instant now = clock.instant();
        TimeWindow everything = TimeWindow.of(Instant.EPOCH, now);
        validate(repository, everything);
        GitHistory history = collector.collect(repository, everything);
        TimeWindow window = TimeWindow.allTime(history.getCommits(), now);
        return run(repository, window, history, options, metricNames);
    }

    private AnalysisReport run(RepositoryRef repository, TimeWindow window, GitHistory history,
                               AnalysisOptions options, List<String> metricNames) {
        MetricInput input = MetricInput.builder()
                .repository(repository)
                .window(window)
                .history(commitFilter.apply(history, options))
                .options(options)
                .build();
        return runner.runAll(resolveNames(metricNames, options), input);
    }

    private List<String> resolveNames(List<String> metricNames, AnalysisOptions options) {
        List<String> requested = metricNames == null || metricNames.isEmpty() ? registry.getNames() : metricNames;
        return requested.stream()
                .filter(name -> !options.getExcludedMetrics().contains(name))
                .collect(Collectors.toList());
    }

    private static void validate(RepositoryRef repository, TimeWindow window) {
        if (repository == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_REPOSITORY, "Repository cannot be null");
        }
        if (window == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_TIME_WINDOW, "Time window cannot be null");
        }
        repository.validateGitRepository();
        log.info("Analysing {} at {} for {}", repository.getName(), repository.getPath(), window);
    }
}
