package eu.devmetrics.app.metrics;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.git.ContributorCount;
import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.git.RepositoryRef;
import eu.devmetrics.app.git.Tag;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a metric may read: the repository, the window, the parsed
 * history and the caller's options. Shared read-only between metrics.
 */
@Value
@Builder
public class MetricInput {
    RepositoryRef repository;
    TimeWindow window;
    @Builder.Default
    GitHistory history = GitHistory.empty();
    @Builder.Default
    AnalysisOptions options = AnalysisOptions.defaults();

    public List<Commit> getCommits() {
        return history.getCommits();
    }

    public List<Commit> getCommitStats() {
        return history.getCommitStats();
    }

    public List<ContributorCount> getContributors() {
        return history.getContributors();
    }

    public List<Tag> getTags() {
        return history.getTags();
    }

    public List<String> getBranches() {
        return history.getBranches();
    }
}
