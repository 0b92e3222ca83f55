package eu.devmetrics.app.metrics.reliability;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.metrics.reliability.LargeCommitStats.SizeCategory;
import eu.devmetrics.app.util.Statistics;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.time.format.TextStyle;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Unusually large commits, with thresholds taken from the repository's own size distribution.
 */
@Component
public class LargeCommitsMetric extends AbstractGitMetric {

    static final int FILE_WEIGHT = 10;
    static final double HIGH_RISK_SCORE = 20.0;
    static final int LARGEST_LIMIT = 20;

    private static final Pattern AND_WORD = Pattern.compile("\\band\\b");

    @Override
    public String getName() {
        return "large_commits";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.RELIABILITY;
    }

    @Override
    public String getDescription() {
        return "Identifies unusually large commits that may indicate poor development practices";
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

        List<Integer> sizes = commits.stream().map(LargeCommitsMetric::size).collect(Collectors.toList());
        List<Double> sorted = Statistics.sorted(sizes);
        LargeCommitStats.Thresholds thresholds = thresholds(sorted);

        List<LargeCommitStats.SizedCommit> large = new ArrayList<>();
        int largeCount = 0;
        int hugeCount = 0;
        for (int i = 0; i < commits.size(); i++) {
            SizeCategory category = thresholds.categorize(sizes.get(i));
            if (category == SizeCategory.LARGE) {
                largeCount++;
            } else if (category == SizeCategory.HUGE) {
                hugeCount++;
            } else {
                continue;
            }
            large.add(sizedCommit(commits.get(i), sizes.get(i), category, thresholds));
        }
        large.sort(Comparator.comparingInt(LargeCommitStats.SizedCommit::getSize).reversed());

        int total = commits.size();
        Map<String, LargeCommitStats.AuthorSizeStats> byAuthor = authorStats(commits, sizes, thresholds);
        Map<Integer, Integer> byHour = new LinkedHashMap<>();
        Map<String, Integer> byDay = new LinkedHashMap<>();
        for (LargeCommitStats.SizedCommit commit : large) {
            byHour.merge(commit.getDate().getHour(), 1, Integer::sum);
            byDay.merge(commit.getDate().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH), 1, Integer::sum);
        }

        LargeCommitStats stats = LargeCommitStats.builder()
                .totalCommits(total)
                .largeCommits(largeCount)
                .hugeCommits(hugeCount)
                .largeCommitRatio(ratio(largeCount, total))
                .hugeCommitRatio(ratio(hugeCount, total))
                .riskScore(riskScore(largeCount, hugeCount, total))
                .avgCommitSize(Statistics.round(Statistics.mean(sizes), 1))
                .thresholds(thresholds)
                .byAuthor(byAuthor)
                .largestCommits(new ArrayList<>(large.subList(0, Math.min(LARGEST_LIMIT, large.size()))))
                .sizeDistribution(distribution(sizes, sorted))
                .commonRiskFactors(commonRiskFactors(large))
                .largeByHourOfDay(byHour)
                .largeByDayOfWeek(byDay)
                .build();

        return MetricComputation.builder()
                .value(new MetricValue.Summary<>(stats))
                .dataPoints(total)
                .meta("large_commit_ratio", stats.getLargeCommitRatio())
                .meta("risk_score", stats.getRiskScore())
                .meta("avg_commit_size", stats.getAvgCommitSize())
                .meta("high_risk_authors", byAuthor.values().stream()
                        .filter(author -> author.getRiskScore() > HIGH_RISK_SCORE).count())
                .meta("largest_commit_author", largestCommitAuthor(byAuthor))
                .meta("size_threshold_large", thresholds.getLarge())
                .meta("size_threshold_huge", thresholds.getHuge())
                .build();
    }

    static int size(Commit commit) {
        return commit.getTotalChanges() + commit.getFileChanges().size() * FILE_WEIGHT;
    }

    static LargeCommitStats.Thresholds thresholds(List<Double> sortedSizes) {
        return LargeCommitStats.Thresholds.builder()
                .small((int) Statistics.percentile(sortedSizes, 25))
                .medium((int) Statistics.percentile(sortedSizes, 50))
                .large((int) Statistics.percentile(sortedSizes, 75))
                .huge((int) Statistics.percentile(sortedSizes, 90))
                .build();
    }

    /**
     * Large counts once, huge three times, against three points per commit. Percent, 2 places.
     */
    static double riskScore(int large, int huge, int total) {
        if (total == 0) {
            return 0.0;
        }
        return Statistics.round((large + huge * 3.0) / (total * 3.0) * 100, 2);
    }

    private static LargeCommitStats.SizedCommit sizedCommit(Commit commit, int size, SizeCategory category,
                                                            LargeCommitStats.Thresholds thresholds) {
        return LargeCommitStats.SizedCommit.builder()
                .hash(commit.getHash())
                .author(commit.getAuthorName())
                .date(commit.getTimestamp())
                .subject(commit.getSubject())
                .size(size)
                .filesChanged(commit.getFileChanges().size())
                .category(category)
                .riskFactors(riskFactors(commit, size, thresholds))
                .build();
    }

    static List<String> riskFactors(Commit commit, int size, LargeCommitStats.Thresholds thresholds) {
        List<String> factors = new ArrayList<>();
        if (size >= thresholds.getHuge()) {
            factors.add("HUGE_SIZE");
        }
        if (size >= thresholds.getLarge()) {
            factors.add("LARGE_SIZE");
        }

        int files = commit.getFileChanges().size();
        if (files > 20) {
            factors.add("MANY_FILES");
        }
        if (files > 50) {
            factors.add("EXCESSIVE_FILES");
        }

        String message = commit.getSubject() == null ? "" : commit.getSubject().toLowerCase(Locale.ROOT);
        if (message.contains("merge")) {
            factors.add("MERGE_COMMIT");
        }
        if (message.length() < 10) {
            factors.add("VAGUE_MESSAGE");
        }
        if (countMatches(AND_WORD.matcher(message)) > 1) {
            factors.add("MULTIPLE_CONCERNS");
        }

        OffsetDateTime time = commit.getTimestamp();
        if (time.getHour() < 9 || time.getHour() > 18) {
            factors.add("OFF_HOURS");
        }
        if (time.getDayOfWeek() == DayOfWeek.SATURDAY || time.getDayOfWeek() == DayOfWeek.SUNDAY) {
            factors.add("WEEKEND");
        }
        return factors;
    }

    private static int countMatches(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static Map<String, Integer> commonRiskFactors(List<LargeCommitStats.SizedCommit> large) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        large.forEach(commit -> commit.getRiskFactors().forEach(f -> counts.merge(f, 1, Integer::sum)));
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }

    private static Map<String, LargeCommitStats.AuthorSizeStats> authorStats(List<Commit> commits, List<Integer> sizes,
                                                                             LargeCommitStats.Thresholds thresholds) {
        Map<String, List<Integer>> sizesByAuthor = new LinkedHashMap<>();
        for (int i = 0; i < commits.size(); i++) {
            sizesByAuthor.computeIfAbsent(commits.get(i).getAuthorName(), k -> new ArrayList<>()).add(sizes.get(i));
        }

        List<Map.Entry<String, LargeCommitStats.AuthorSizeStats>> entries = new ArrayList<>();
        sizesByAuthor.forEach((author, authorSizes) -> {
            int large = (int) authorSizes.stream().filter(s -> thresholds.categorize(s) == SizeCategory.LARGE).count();
            int huge = (int) authorSizes.stream().filter(s -> thresholds.categorize(s) == SizeCategory.HUGE).count();
            entries.add(Map.entry(author, LargeCommitStats.AuthorSizeStats.builder()
                    .totalCommits(authorSizes.size())
                    .largeCommits(large)
                    .hugeCommits(huge)
                    .avgCommitSize(Statistics.round(Statistics.mean(authorSizes), 1))
                    .maxCommitSize(Collections.max(authorSizes))
                    .largeCommitRatio(ratio(large + huge, authorSizes.size()))
                    .riskScore(riskScore(large, huge, authorSizes.size()))
                    .build()));
        });
        entries.sort(Comparator.comparingDouble(
                (Map.Entry<String, LargeCommitStats.AuthorSizeStats> e) -> e.getValue().getRiskScore()).reversed());

        Map<String, LargeCommitStats.AuthorSizeStats> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }

    private static String largestCommitAuthor(Map<String, LargeCommitStats.AuthorSizeStats> byAuthor) {
        String best = null;
        int bestSize = Integer.MIN_VALUE;
        for (Map.Entry<String, LargeCommitStats.AuthorSizeStats> entry : byAuthor.entrySet()) {
            if (entry.getValue().getMaxCommitSize() > bestSize) {
                best = entry.getKey();
                bestSize = entry.getValue().getMaxCommitSize();
            }
        }
        return best;
    }

    private static LargeCommitStats.SizeDistribution distribution(List<Integer> sizes, List<Double> sorted) {
        return LargeCommitStats.SizeDistribution.builder()
                .min(sorted.get(0).intValue())
                .max(sorted.get(sorted.size() - 1).intValue())
                .median(Statistics.percentile(sorted, 50))
                .p75(Statistics.percentile(sorted, 75))
                .p90(Statistics.percentile(sorted, 90))
                .p95(Statistics.percentile(sorted, 95))
                .p99(Statistics.percentile(sorted, 99))
                .stdDeviation(Statistics.round(Statistics.standardDeviation(sizes), 2))
                .build();
    }

    static double ratio(int count, int total) {
        return Statistics.round(Statistics.percentage(count, total), 2);
    }
}
