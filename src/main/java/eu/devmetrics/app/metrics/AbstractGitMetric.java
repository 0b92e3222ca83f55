package eu.devmetrics.app.metrics;

import lombok.extern.slf4j.Slf4j;

/**
 * Base class turning exceptions thrown by {@link #compute(MetricInput)} into failures.
 */
@Slf4j
public abstract class AbstractGitMetric implements GitMetric {

    @Override
    public final Result<MetricComputation, ComputationFailure> calculate(MetricInput input) {
        try {
            return Result.success(compute(input));
        } catch (Exception e) {
            log.error("Metric {} failed", getName(), e);
            return Result.failure(ComputationFailure.from(e));
        }
    }

    /**
     * Computes the metric. Empty input must yield the metric's empty value with zero data points.
     */
    protected abstract MetricComputation compute(MetricInput input);
}
