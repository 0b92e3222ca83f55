package eu.devmetrics.app.metrics;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Results of a batch run, one per requested metric in request order.
 */
@Value
public class AnalysisReport {
    List<MetricResult> results;

    public AnalysisReport(List<MetricResult> results) {
        this.results = List.copyOf(results);
    }

    public long getSucceeded() {
        return results.stream().filter(MetricResult::isSuccess).count();
    }

    public long getFailed() {
        return results.stream().filter(MetricResult::isFailed).count();
    }

    public Optional<MetricResult> getResult(String metricName) {
        return results.stream()
                .filter(result -> result.getMetricName().equals(metricName))
                .findFirst();
    }
}
