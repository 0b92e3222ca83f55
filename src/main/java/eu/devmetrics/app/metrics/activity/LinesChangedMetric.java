package eu.devmetrics.app.metrics.activity;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.util.Statistics;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Lines added, removed and net per author, most changed lines first.
 */
@Component
public class LinesChangedMetric extends AbstractGitMetric {

    @Override
    public String getName() {
        return "lines_changed";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.COMMIT_ACTIVITY;
    }

    @Override
    public String getDescription() {
        return "Lines added, removed, and net changes by developer";
    }

    @Override
    public String getDataPointsLabel() {
        return "commits";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<Commit> commits = input.getCommitStats();
        if (commits.isEmpty()) {
            return MetricComputation.empty(new MetricValue.KeyedTable<AuthorChangeStats>(Collections.emptyMap()));
        }

        Map<String, AuthorChangeStats> byAuthor = new LinkedHashMap<>();
        for (Commit commit : commits) {
            AuthorChangeStats stats = byAuthor.computeIfAbsent(authorKey(commit), key -> AuthorChangeStats.builder()
                    .authorName(commit.getAuthorName())
                    .authorEmail(commit.getAuthorEmail())
                    .build());
            stats.setAdditions(stats.getAdditions() + commit.getAdditions());
            stats.setDeletions(stats.getDeletions() + commit.getDeletions());
            stats.setCommits(stats.getCommits() + 1);
        }

        List<AuthorChangeStats> sorted = new ArrayList<>(byAuthor.values());
        sorted.sort(Comparator.comparingInt(AuthorChangeStats::getTotalChanges).reversed());
        Map<String, AuthorChangeStats> result = new LinkedHashMap<>();
        sorted.forEach(stats -> result.put(stats.getDisplayName(), stats));

        int additions = sorted.stream().mapToInt(AuthorChangeStats::getAdditions).sum();
        int deletions = sorted.stream().mapToInt(AuthorChangeStats::getDeletions).sum();
        int total = additions + deletions;

        return MetricComputation.builder()
                .value(new MetricValue.KeyedTable<>(result))
                .dataPoints(commits.size())
                .meta("total_additions", additions)
                .meta("total_deletions", deletions)
                .meta("net_additions", additions - deletions)
                .meta("total_changes", total)
                .meta("overall_churn_ratio", Statistics.round(Statistics.percentage(deletions, total), 1))
                .meta("contributing_authors", sorted.size())
                .meta("avg_changes_per_author", Statistics.round((double) total / sorted.size(), 2))
                .build();
    }

    private static String authorKey(Commit commit) {
        return commit.hasEmail() ? commit.getAuthorName() + " <" + commit.getAuthorEmail() + ">" : commit.getAuthorName();
    }
}
