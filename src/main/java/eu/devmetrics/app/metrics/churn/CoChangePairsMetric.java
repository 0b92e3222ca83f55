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
 * Pairs of files modified in the same commits, strongest coupling first.
 */
@Component
public class CoChangePairsMetric extends AbstractGitMetric {

    static final double HOTSPOT_STRENGTH = 0.3;
    static final int HOTSPOT_MIN_PAIRS = 3;

    @Override
    public String getName() {
        return "co_change_pairs";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.CODE_CHURN;
    }

    @Override
    public String getDescription() {
        return "Files that are frequently modified together, indicating coupling";
    }

    @Override
    public String getDataPointsLabel() {
        return "commits";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<Commit> commits = input.getCommitStats();
        if (commits.isEmpty()) {
            return MetricComputation.empty(new MetricValue.KeyedTable<CoChangePair>(Collections.emptyMap()));
        }

        Map<String, Integer> fileCommits = new HashMap<>();
        Map<String, Integer> pairCounts = new LinkedHashMap<>();
        Map<String, String[]> pairFiles = new HashMap<>();

        for (Commit commit : commits) {
            List<String> files = commit.getFileChanges().stream()
                    .map(FileChange::getFilename)
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
            files.forEach(file -> fileCommits.merge(file, 1, Integer::sum));
            for (int i = 0; i < files.size(); i++) {
                for (int j = i + 1; j < files.size(); j++) {
                    String key = CoChangePair.key(files.get(i), files.get(j));
                    pairCounts.merge(key, 1, Integer::sum);
                    pairFiles.putIfAbsent(key, new String[]{files.get(i), files.get(j)});
                }
            }
        }

        List<CoChangePair> pairs = new ArrayList<>();
        pairCounts.forEach((key, co) -> {
            String[] files = pairFiles.get(key);
            int total1 = fileCommits.get(files[0]);
            int total2 = fileCommits.get(files[1]);
            double strength = CoChangePair.couplingStrength(co, total1, total2);
            pairs.add(CoChangePair.builder()
                    .file1(files[0])
                    .file2(files[1])
                    .coChanges(co)
                    .file1TotalChanges(total1)
                    .file2TotalChanges(total2)
                    .couplingStrength(strength)
                    .couplingPercentage(Statistics.round(Statistics.percentage(co, Math.min(total1, total2)), 1))
                    .couplingCategory(CoChangePair.CouplingCategory.of(strength))
                    .build());
        });
        pairs.sort(Comparator.comparingDouble(CoChangePair::getCouplingStrength).reversed());

        Map<String, CoChangePair> result = new LinkedHashMap<>();
        pairs.forEach(pair -> result.put(CoChangePair.key(pair.getFile1(), pair.getFile2()), pair));

        List<Double> strengths = pairs.stream().map(CoChangePair::getCouplingStrength).collect(Collectors.toList());
        return MetricComputation.builder()
                .value(new MetricValue.KeyedTable<>(result))
                .dataPoints(commits.size())
                .meta("total_file_pairs", pairs.size())
                .meta("avg_coupling_strength", Statistics.round(Statistics.mean(strengths), 3))
                .meta("max_coupling_strength", strengths.isEmpty() ? 0.0 : Collections.max(strengths))
                .meta("high_coupling_pairs", countIn(pairs, EnumSet.of(CoChangePair.CouplingCategory.HIGH)))
                .meta("medium_coupling_pairs", countIn(pairs, EnumSet.of(CoChangePair.CouplingCategory.MEDIUM)))
                .meta("low_coupling_pairs", countIn(pairs,
                        EnumSet.of(CoChangePair.CouplingCategory.LOW, CoChangePair.CouplingCategory.MINIMAL)))
                .meta("architectural_hotspots", architecturalHotspots(pairs))
                .build();
    }

    private static long countIn(List<CoChangePair> pairs, Set<CoChangePair.CouplingCategory> categories) {
        return pairs.stream().filter(pair -> categories.contains(pair.getCouplingCategory())).count();
    }

    /**
     * Files that take part in at least three pairs coupled above 0.3, most coupled first.
     */
    static Map<String, Integer> architecturalHotspots(List<CoChangePair> pairs) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CoChangePair pair : pairs) {
            if (pair.getCouplingStrength() > HOTSPOT_STRENGTH) {
                counts.merge(pair.getFile1(), 1, Integer::sum);
                counts.merge(pair.getFile2(), 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> hotspots = counts.entrySet().stream()
                .filter(entry -> entry.getValue() >= HOTSPOT_MIN_PAIRS)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .collect(Collectors.toList());
        Map<String, Integer> result = new LinkedHashMap<>();
        hotspots.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }
}
