package eu.devmetrics.app.metrics;

/**
 * A metric computed from parsed git history.
 * Implementations must not throw: failures are reported through the {@link Result}.
 */
public interface GitMetric {

    String getName();

    MetricCategory getCategory();

    String getDescription();

    /**
     * What one data point counts, e.g. "commits" or "files".
     */
    String getDataPointsLabel();

    Result<MetricComputation, ComputationFailure> calculate(MetricInput input);
}
