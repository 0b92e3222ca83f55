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

import java.time.OffsetDateTime;
import java.util.*;

/**
 * Primary owner and contribution distribution of each file, most concentrated first.
 */
@Component
public class FileOwnershipMetric extends AbstractGitMetric {

    @Override
    public String getName() {
        return "file_ownership";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.CODE_CHURN;
    }

    @Override
    public String getDescription() {
        return "Primary ownership and contribution distribution for each file";
    }

    @Override
    public String getDataPointsLabel() {
        return "commits";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<Commit> commits = input.getCommitStats();
        if (commits.isEmpty()) {
            return MetricComputation.empty(new MetricValue.KeyedTable<FileOwnershipStats>(Collections.emptyMap()));
        }

        Map<String, Accumulator> byFile = new LinkedHashMap<>();
        for (Commit commit : commits) {
            for (FileChange change : commit.getFileChanges()) {
                byFile.computeIfAbsent(change.getFilename(), k -> new Accumulator()).add(commit, change);
            }
        }

        List<Map.Entry<String, FileOwnershipStats>> entries = new ArrayList<>();
        byFile.forEach((file, acc) -> entries.add(Map.entry(file, acc.toStats())));
        entries.sort(Comparator.comparingDouble(
                (Map.Entry<String, FileOwnershipStats> e) -> e.getValue().getOwnershipConcentration()).reversed());

        Map<String, FileOwnershipStats> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.getKey(), entry.getValue()));

        List<Double> concentrations = new ArrayList<>();
        result.values().forEach(stats -> concentrations.add(stats.getOwnershipConcentration()));

        return MetricComputation.builder()
                .value(new MetricValue.KeyedTable<>(result))
                .dataPoints(commits.size())
                .meta("total_files_analyzed", result.size())
                .meta("avg_ownership_concentration", Statistics.round(Statistics.mean(concentrations), 1))
                .meta("highly_concentrated_files", concentrations.stream().filter(c -> c > 80).count())
                .meta("moderately_concentrated_files", concentrations.stream().filter(c -> c > 50 && c <= 80).count())
                .meta("distributed_ownership_files", concentrations.stream().filter(c -> c <= 50).count())
                .meta("single_owner_files", result.values().stream().filter(s -> s.getContributorCount() == 1).count())
                .build();
    }

    /**
     * HHI over percentage shares: {@code sum((pct / 100)^2) * 100}; a single contributor gives 100.
     */
    static double concentration(Collection<Double> percentages) {
        if (percentages.size() <= 1) {
            return 100.0;
        }
        double hhi = 0.0;
        for (double pct : percentages) {
            hhi += Math.pow(pct / 100.0, 2);
        }
        return Statistics.round(hhi * 100.0, 1);
    }

    private static class Accumulator {
        final Map<String, Integer> changesByAuthor = new LinkedHashMap<>();
        int totalChanges;
        int commits;
        String lastAuthor;
        OffsetDateTime lastDate;

        void add(Commit commit, FileChange change) {
            int changes = change.getTotalChanges();
            changesByAuthor.merge(commit.getAuthorName(), changes, Integer::sum);
            totalChanges += changes;
            commits++;
            if (lastDate == null || !commit.getInstant().isBefore(lastDate.toInstant())) {
                lastDate = commit.getTimestamp();
                lastAuthor = commit.getAuthorName();
            }
        }

        FileOwnershipStats toStats() {
            Map<String, Double> percentages = new LinkedHashMap<>();
            String owner = null;
            int ownerChanges = -1;
            for (Map.Entry<String, Integer> entry : changesByAuthor.entrySet()) {
                percentages.put(entry.getKey(), Statistics.round(Statistics.percentage(entry.getValue(), totalChanges), 1));
                if (entry.getValue() > ownerChanges) {
                    owner = entry.getKey();
                    ownerChanges = entry.getValue();
                }
            }

            List<Map.Entry<String, Double>> sorted = new ArrayList<>(percentages.entrySet());
            sorted.sort(Map.Entry.<String, Double>comparingByValue().reversed());
            Map<String, Double> distribution = new LinkedHashMap<>();
            sorted.forEach(entry -> distribution.put(entry.getKey(), entry.getValue()));

            double maxShare = percentages.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            return FileOwnershipStats.builder()
                    .primaryOwner(owner)
                    .primaryOwnerPercentage(Statistics.round(Statistics.percentage(ownerChanges, totalChanges), 1))
                    .lastModifiedBy(lastAuthor)
                    .lastModifiedDate(lastDate)
                    .totalCommits(commits)
                    .totalChanges(totalChanges)
                    .contributorCount(changesByAuthor.size())
                    .ownershipDistribution(distribution)
                    .ownershipConcentration(concentration(percentages.values()))
                    .ownershipType(FileOwnershipStats.OwnershipType.of(changesByAuthor.size(), maxShare))
                    .build();
        }
    }
}
