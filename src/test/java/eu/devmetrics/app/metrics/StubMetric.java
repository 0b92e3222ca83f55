package eu.devmetrics.app.metrics;

import java.util.function.Function;

/**
 * Metric with a caller-supplied computation, for exercising the runner and registry.
 */
public class StubMetric extends AbstractGitMetric {

    private final String name;
    private final MetricCategory category;
    private final Function<MetricInput, MetricComputation> computation;

    public StubMetric(String name, MetricCategory category, Function<MetricInput, MetricComputation> computation) {
        this.name = name;
        this.category = category;
        this.computation = computation;
    }

    /**
     * Counts the commits it receives.
     */
    public static StubMetric commitCounter(String name) {
        return new StubMetric(name, MetricCategory.COMMIT_ACTIVITY, input -> MetricComputation.builder()
                .value(new MetricValue.Scalar(input.getCommits().size()))
                .dataPoints(input.getCommits().size())
                .meta("counted", true)
                .build());
    }

    public static StubMetric failing(String name) {
        return new StubMetric(name, MetricCategory.RELIABILITY, input -> {
            throw new IllegalStateException("history is inconsistent");
        });
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public MetricCategory getCategory() {
        return category;
    }

    @Override
    public String getDescription() {
        return "Stub metric " + name;
    }

    @Override
    public String getDataPointsLabel() {
        return "commits";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        return computation.apply(input);
    }
}
