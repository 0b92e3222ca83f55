package eu.devmetrics.app.metrics.activity;

import eu.devmetrics.app.git.ContributorCount;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.util.Statistics;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Number of commits per contributor identity, highest first.
 */
@Component
public class CommitsPerDeveloperMetric extends AbstractGitMetric {

    @Override
    public String getName() {
        return "commits_per_developer";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.COMMIT_ACTIVITY;
    }

    @Override
    public String getDescription() {
        return "Number of commits per developer in the specified time period";
    }

    @Override
    public String getDataPointsLabel() {
        return "contributors";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<ContributorCount> contributors = input.getContributors();
        if (contributors.isEmpty()) {
            return MetricComputation.empty(new MetricValue.Distribution(Collections.emptyMap()));
        }

        // the same identity may appear more than once, e.g. from several shortlog sources
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ContributorCount contributor : contributors) {
            counts.merge(contributor.getIdentity(), contributor.getCommitCount(), Integer::sum);
        }

        List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> byCount = new LinkedHashMap<>();
        sorted.forEach(entry -> byCount.put(entry.getKey(), entry.getValue()));

        int totalCommits = contributors.stream().mapToInt(ContributorCount::getCommitCount).sum();
        String topContributor = byCount.keySet().iterator().next();

        return MetricComputation.builder()
                .value(new MetricValue.Distribution(byCount))
                .dataPoints(counts.size())
                .meta("total_contributors", counts.size())
                .meta("total_commits", totalCommits)
                .meta("avg_commits_per_contributor", Statistics.round((double) totalCommits / counts.size(), 2))
                .meta("top_contributor", topContributor)
                .build();
    }
}
