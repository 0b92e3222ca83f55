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
 * Number of distinct authors per file (bus factor analysis).
 */
@Component
public class AuthorsPerFileMetric extends AbstractGitMetric {

    @Override
    public String getName() {
        return "authors_per_file";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.CODE_CHURN;
    }

    @Override
    public String getDescription() {
        return "Number of distinct authors who have modified each file (bus factor analysis)";
    }

    @Override
    public String getDataPointsLabel() {
        return "commits";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<Commit> commits = input.getCommitStats();
        if (commits.isEmpty()) {
            return MetricComputation.empty(new MetricValue.KeyedTable<FileAuthorsStats>(Collections.emptyMap()));
        }

        Map<String, Set<String>> fileAuthors = new LinkedHashMap<>();
        for (Commit commit : commits) {
            for (FileChange change : commit.getFileChanges()) {
                fileAuthors.computeIfAbsent(change.getFilename(), k -> new TreeSet<>()).add(commit.getAuthorName());
            }
        }

        List<Map.Entry<String, Set<String>>> entries = new ArrayList<>(fileAuthors.entrySet());
        entries.sort(Comparator.comparingInt((Map.Entry<String, Set<String>> e) -> e.getValue().size()).reversed());

        Map<String, FileAuthorsStats> result = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : entries) {
            int count = entry.getValue().size();
            result.put(entry.getKey(), FileAuthorsStats.builder()
                    .authorCount(count)
                    .authors(new ArrayList<>(entry.getValue()))
                    .busFactorRisk(FileAuthorsStats.BusFactorRisk.forAuthorCount(count))
                    .ownershipType(FileAuthorsStats.AuthorshipType.forAuthorCount(count))
                    .build());
        }

        List<Integer> counts = result.values().stream().map(FileAuthorsStats::getAuthorCount).collect(Collectors.toList());
        int files = result.size();
        int single = (int) counts.stream().filter(c -> c == 1).count();
        int shared = (int) counts.stream().filter(c -> c > 1 && c <= 3).count();
        int highlyShared = (int) counts.stream().filter(c -> c > 3).count();

        return MetricComputation.builder()
                .value(new MetricValue.KeyedTable<>(result))
                .dataPoints(commits.size())
                .meta("total_files_analyzed", files)
                .meta("avg_authors_per_file", files > 0 ? Statistics.round(Statistics.mean(counts), 2) : 0.0)
                .meta("max_authors_per_file", counts.isEmpty() ? 0 : Collections.max(counts))
                .meta("min_authors_per_file", counts.isEmpty() ? 0 : Collections.min(counts))
                .meta("single_author_files", single)
                .meta("shared_files", shared)
                .meta("highly_shared_files", highlyShared)
                .meta("bus_factor_risk_percentage", Statistics.round(Statistics.percentage(single, files), 1))
                .meta("collaboration_score", collaborationScore(single, shared, highlyShared))
                .build();
    }

    /**
     * {@code (shared * 50 + collaborative * 100 - single * 10) / files}, clamped to [0, 100].
     * Collaborative counts every file with more than three authors.
     */
    static double collaborationScore(int single, int shared, int collaborative) {
        int files = single + shared + collaborative;
        if (files == 0) {
            return 0.0;
        }
        double score = (shared * 50.0 + collaborative * 100.0 - single * 10.0) / files;
        return Statistics.round(Math.max(0.0, Math.min(score, 100.0)), 1);
    }
}
