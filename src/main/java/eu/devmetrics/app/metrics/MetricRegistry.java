package eu.devmetrics.app.metrics;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Looks up metrics by name and category.
 * Metrics are ordered by category, then by name.
 */
@Component
public class MetricRegistry {

    private final Map<String, GitMetric> metrics = new LinkedHashMap<>();

    public MetricRegistry(List<GitMetric> available) {
        available.stream()
                .sorted(Comparator.comparing(GitMetric::getCategory).thenComparing(GitMetric::getName))
                .forEach(metric -> {
                    if (metrics.putIfAbsent(metric.getName(), metric) != null) {
                        throw new IllegalStateException("Duplicate metric name: " + metric.getName());
                    }
                });
    }

    public Optional<GitMetric> find(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    public List<String> getNames() {
        return new ArrayList<>(metrics.keySet());
    }

    public List<String> getNames(MetricCategory category) {
        return metrics.values().stream()
                .filter(metric -> metric.getCategory() == category)
                .map(GitMetric::getName)
                .collect(Collectors.toList());
    }

    public boolean contains(String name) {
        return metrics.containsKey(name);
    }
}
