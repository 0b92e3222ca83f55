package eu.devmetrics.app.metrics.churn;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.git.FileChange;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.util.Statistics;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Files ranked by churn, the total of lines added and deleted.
 */
@Component
public class FileChurnMetric extends AbstractGitMetric {

    static final int HIGH_CHURN = 1000;
    static final int MEDIUM_CHURN = 100;

    @Override
    public String getName() {
        return "file_churn";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.CODE_CHURN;
    }

    @Override
    public String getDescription() {
        return "Files with highest churn (total lines added + deleted)";
    }

    @Override
    public String getDataPointsLabel() {
        return "commits";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<Commit> commits = input.getCommitStats();
        if (commits.isEmpty()) {
            return MetricComputation.empty(new MetricValue.Table<FileChurnStats>(Collections.emptyList()));
        }

        Map<String, Accumulator> byFile = new LinkedHashMap<>();
        for (Commit commit : commits) {
            for (FileChange change : commit.getFileChanges()) {
                Accumulator acc = byFile.computeIfAbsent(change.getFilename(), k -> new Accumulator());
                acc.additions += change.getAdditions();
                acc.deletions += change.getDeletions();
                acc.commits++;
                acc.authors.add(commit.getAuthorName());
            }
        }

        List<FileChurnStats> rows = byFile.entrySet().stream()
                .map(entry -> entry.getValue().toStats(entry.getKey()))
                .sorted(Comparator.comparingInt(FileChurnStats::getTotalChurn).reversed())
                .collect(Collectors.toList());

        int totalFileChanges = commits.stream().mapToInt(c -> c.getFileChanges().size()).sum();
        long high = rows.stream().filter(r -> r.getTotalChurn() > HIGH_CHURN).count();
        long medium = rows.stream().filter(r -> r.getTotalChurn() > MEDIUM_CHURN && r.getTotalChurn() <= HIGH_CHURN).count();
        long low = rows.stream().filter(r -> r.getTotalChurn() <= MEDIUM_CHURN).count();
        int files = rows.size();

        return MetricComputation.builder()
                .value(new MetricValue.Table<>(rows))
                .dataPoints(commits.size())
                .meta("total_files_changed", files)
                .meta("total_file_changes", totalFileChanges)
                .meta("avg_changes_per_file", files > 0 ? Statistics.round((double) totalFileChanges / files, 2) : 0.0)
                .meta("high_churn_files", high)
                .meta("medium_churn_files", medium)
                .meta("low_churn_files", low)
                .meta("hotspot_percentage", Statistics.round(Statistics.percentage(high, files), 1))
                .build();
    }

    private static class Accumulator {
        int additions;
        int deletions;
        int commits;
        final Set<String> authors = new LinkedHashSet<>();

        FileChurnStats toStats(String filename) {
            int total = additions + deletions;
            return FileChurnStats.builder()
                    .filename(filename)
                    .totalChurn(total)
                    .additions(additions)
                    .deletions(deletions)
                    .netChanges(additions - deletions)
                    .commits(commits)
                    .authorsCount(authors.size())
                    .authors(new ArrayList<>(authors))
                    .avgChurnPerCommit(commits > 0 ? Statistics.round((double) total / commits, 2) : 0.0)
                    .churnRatio(Statistics.round(Statistics.percentage(deletions, total), 1))
                    .build();
        }
    }
}
