package eu.devmetrics.app.metrics.activity;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.util.Statistics;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Commit size (lines added plus deleted) bucketed into small, medium, large and huge.
 */
@Component
public class CommitSizeMetric extends AbstractGitMetric {

    static final int SMALL_MAX = 10;
    static final int MEDIUM_MAX = 100;
    static final int LARGE_MAX = 500;

    @Override
    public String getName() {
        return "commit_size";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.COMMIT_ACTIVITY;
    }

    @Override
    public String getDescription() {
        return "Distribution of commit sizes by lines changed (added + deleted)";
    }

    @Override
    public String getDataPointsLabel() {
        return "commits";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<Commit> commits = input.getCommitStats();
        if (commits.isEmpty()) {
            return MetricComputation.empty(MetricValue.Summary.empty());
        }

        List<Integer> sizes = commits.stream().map(Commit::getTotalChanges).collect(Collectors.toList());
        int total = sizes.size();
        int small = (int) sizes.stream().filter(s -> s <= SMALL_MAX).count();
        int medium = (int) sizes.stream().filter(s -> s > SMALL_MAX && s <= MEDIUM_MAX).count();
        int large = (int) sizes.stream().filter(s -> s > MEDIUM_MAX && s <= LARGE_MAX).count();
        int huge = (int) sizes.stream().filter(s -> s > LARGE_MAX).count();

        CommitSizeStats stats = CommitSizeStats.builder()
                .totalCommits(total)
                .averageSize(Statistics.round(Statistics.mean(sizes), 2))
                .medianSize(Statistics.round(Statistics.median(sizes), 2))
                .minSize(Collections.min(sizes))
                .maxSize(Collections.max(sizes))
                .smallCommits(small)
                .mediumCommits(medium)
                .largeCommits(large)
                .hugeCommits(huge)
                .smallPercent(Statistics.round(Statistics.percentage(small, total), 1))
                .mediumPercent(Statistics.round(Statistics.percentage(medium, total), 1))
                .largePercent(Statistics.round(Statistics.percentage(large, total), 1))
                .hugePercent(Statistics.round(Statistics.percentage(huge, total), 1))
                .build();

        int additions = commits.stream().mapToInt(Commit::getAdditions).sum();
        int deletions = commits.stream().mapToInt(Commit::getDeletions).sum();
        int files = commits.stream().mapToInt(c -> c.getFileChanges().size()).sum();

        return MetricComputation.builder()
                .value(new MetricValue.Summary<>(stats))
                .dataPoints(total)
                .meta("total_lines_changed", additions + deletions)
                .meta("total_additions", additions)
                .meta("total_deletions", deletions)
                .meta("net_lines", additions - deletions)
                .meta("files_per_commit", Statistics.round((double) files / total, 2))
                .build();
    }
}
