package eu.devmetrics.app.metrics;

import eu.devmetrics.app.util.Statistics;
import eu.devmetrics.app.validation.MetricValidationException;
import eu.devmetrics.app.validation.MetricValidationException.ValidationErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service running metrics sequentially and wrapping each outcome in a {@link MetricResult}.
 * A failing metric never stops the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricRunner {

    private final MetricRegistry registry;

    /**
     * Runs one metric.
     *
     * @throws MetricValidationException if the input has no repository or no window
     */
    public MetricResult run(GitMetric metric, MetricInput input) {
        validate(input);

        long start = System.nanoTime();
        Result<MetricComputation, ComputationFailure> result;
        try {
            result = metric.calculate(input);
        } catch (RuntimeException e) {
            log.error("Metric {} threw instead of returning a failure", metric.getName(), e);
            result = Result.failure(ComputationFailure.from(e));
        }
        double executionTime = Statistics.round((System.nanoTime() - start) / 1_000_000_000.0, 3);

        return result.fold(
                computation -> success(metric, input, computation, executionTime),
                failure -> failure(metric.getName(), metric.getCategory().getKey(),
                        metric.getDataPointsLabel(), input, failure, executionTime));
    }

    /**
     * Runs the named metrics in the given order. Unknown names produce failed results.
     */
    public AnalysisReport runAll(List<String> metricNames, MetricInput input) {
        validate(input);

        List<MetricResult> results = new ArrayList<>();
        for (String name : metricNames) {
            MetricResult result = registry.find(name)
                    .map(metric -> run(metric, input))
                    .orElseGet(() -> failure(name, "unknown", "records", input,
                            new ComputationFailure(IllegalArgumentException.class.getSimpleName(),
                                    "Unknown metric: " + name), 0.0));
            if (result.isFailed()) {
                log.warn("Metric {} failed: {}", name, result.getError());
            } else {
                log.debug("Metric {} completed in {}s", name, result.getMetadata().get(MetricResult.EXECUTION_TIME));
            }
            results.add(result);
        }

        AnalysisReport report = new AnalysisReport(results);
        log.info("Analysis of {} finished: {} succeeded, {} failed",
                input.getRepository().getName(), report.getSucceeded(), report.getFailed());
        return report;
    }

    private static void validate(MetricInput input) {
        if (input == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_INPUT, "Metric input cannot be null");
        }
        if (input.getRepository() == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_REPOSITORY, "Repository cannot be null");
        }
        if (input.getWindow() == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_TIME_WINDOW, "Time window cannot be null");
        }
    }

    private static MetricResult success(GitMetric metric, MetricInput input,
                                        MetricComputation computation, double executionTime) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetricResult.CATEGORY, metric.getCategory().getKey());
        metadata.put(MetricResult.DATA_POINTS, computation.getDataPoints());
        metadata.put(MetricResult.DATA_POINTS_LABEL, metric.getDataPointsLabel());
        metadata.put(MetricResult.COMPUTED_AT, Instant.now());
        metadata.put(MetricResult.OPTIONS_USED, input.getOptions().toMap());
        metadata.putAll(computation.getMetadata());
        metadata.put(MetricResult.EXECUTION_TIME, executionTime);

        return MetricResult.builder()
                .metricName(metric.getName())
                .value(computation.getValue())
                .repository(input.getRepository().getName())
                .timeWindow(input.getWindow())
                .metadata(metadata)
                .build();
    }

    private static MetricResult failure(String name, String category, String dataPointsLabel,
                                        MetricInput input, ComputationFailure failure, double executionTime) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetricResult.ERROR_CLASS, failure.errorClass());
        metadata.put(MetricResult.CATEGORY, category);
        metadata.put(MetricResult.DATA_POINTS, 0);
        metadata.put(MetricResult.DATA_POINTS_LABEL, dataPointsLabel);
        metadata.put(MetricResult.EXECUTION_TIME, executionTime);

        return MetricResult.builder()
                .metricName(name)
                .repository(input.getRepository().getName())
                .timeWindow(input.getWindow())
                .metadata(metadata)
                .error(failure.message())
                .build();
    }
}
