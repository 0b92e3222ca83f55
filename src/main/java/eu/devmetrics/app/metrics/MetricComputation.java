package eu.devmetrics.app.metrics;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Successful output of a metric: its value, the number of records it was
 * computed from and the metric-specific metadata.
 */
@Value
@Builder
public class MetricComputation {
    MetricValue value;
    int dataPoints;
    @Singular("meta")
    Map<String, Object> metadata;

    public static MetricComputation empty(MetricValue value) {
        return MetricComputation.builder().value(value).dataPoints(0).build();
    }
}
