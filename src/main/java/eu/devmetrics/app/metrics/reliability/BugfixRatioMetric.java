package eu.devmetrics.app.metrics.reliability;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.util.Statistics;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.*;

/**
 * Proportion of bugfix commits against feature and maintenance work.
 */
@Component
public class BugfixRatioMetric extends AbstractGitMetric {

    static final double HIGH_BUGFIX_RATIO = 30.0;
    static final int EXAMPLES_PER_TYPE = 10;

    private static final List<String> URGENT_KEYWORDS =
            List.of("urgent", "critical", "hotfix", "emergency", "immediate", "asap");
    private static final List<String> SEVERITY_KEYWORDS =
            List.of("critical", "major", "minor", "trivial", "blocker");
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    @Override
    public String getName() {
        return "bugfix_ratio";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.RELIABILITY;
    }

    @Override
    public String getDescription() {
        return "Analyzes the proportion of commits that are bugfixes vs feature development";
    }

    @Override
    public String getDataPointsLabel() {
        return "commits";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<Commit> commits = input.getCommits();
        if (commits.isEmpty()) {
            return MetricComputation.empty(MetricValue.Summary.empty());
        }

        Map<CommitType, List<Commit>> byType = new EnumMap<>(CommitType.class);
        for (CommitType type : CommitType.values()) {
            byType.put(type, new ArrayList<>());
        }
        commits.forEach(commit -> byType.get(CommitType.classify(commit.getSubject())).add(commit));

        int total = commits.size();
        int bugfixes = byType.get(CommitType.BUGFIX).size();
        int features = byType.get(CommitType.FEATURE).size();
        int maintenance = byType.get(CommitType.MAINTENANCE).size();

        Map<CommitType, List<Commit>> examples = new EnumMap<>(CommitType.class);
        for (CommitType type : List.of(CommitType.BUGFIX, CommitType.FEATURE, CommitType.MAINTENANCE)) {
            List<Commit> all = byType.get(type);
            examples.put(type, new ArrayList<>(all.subList(0, Math.min(EXAMPLES_PER_TYPE, all.size()))));
        }

        Map<String, BugfixStats.AuthorBugfixStats> byAuthor = authorStats(commits);
        BugfixStats stats = BugfixStats.builder()
                .totalCommits(total)
                .bugfixCommits(bugfixes)
                .featureCommits(features)
                .maintenanceCommits(maintenance)
                .bugfixRatio(ratio(bugfixes, total))
                .featureRatio(ratio(features, total))
                .maintenanceRatio(ratio(maintenance, total))
                .qualityScore(qualityScore(bugfixes, features))
                .byAuthor(byAuthor)
                .examples(examples)
                .timePatterns(timePatterns(byType.get(CommitType.BUGFIX)))
                .build();

        return MetricComputation.builder()
                .value(new MetricValue.Summary<>(stats))
                .dataPoints(total)
                .meta("bugfix_ratio", stats.getBugfixRatio())
                .meta("quality_score", stats.getQualityScore())
                .meta("high_bugfix_authors", byAuthor.values().stream()
                        .filter(author -> author.getBugfixRatio() > HIGH_BUGFIX_RATIO).count())
                .meta("most_reliable_author", mostReliableAuthor(byAuthor))
                .meta("bugfix_trend", stats.getTimePatterns() == null ? 0.0 : bugfixTrend(stats.getTimePatterns().getByMonth()))
                .build();
    }

    private static Map<String, BugfixStats.AuthorBugfixStats> authorStats(List<Commit> commits) {
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (Commit commit : commits) {
            int[] row = counts.computeIfAbsent(commit.getAuthorName(), k -> new int[4]);
            row[0]++;
            switch (CommitType.classify(commit.getSubject())) {
                case BUGFIX -> row[1]++;
                case FEATURE -> row[2]++;
                case MAINTENANCE -> row[3]++;
                default -> {
                }
            }
        }

        List<Map.Entry<String, BugfixStats.AuthorBugfixStats>> entries = new ArrayList<>();
        counts.forEach((author, row) -> entries.add(Map.entry(author, BugfixStats.AuthorBugfixStats.builder()
                .totalCommits(row[0])
                .bugfixCommits(row[1])
                .featureCommits(row[2])
                .maintenanceCommits(row[3])
                .bugfixRatio(ratio(row[1], row[0]))
                .featureRatio(ratio(row[2], row[0]))
                .qualityScore(qualityScore(row[1], row[2]))
                .build())));
        entries.sort(Comparator.comparingDouble(
                (Map.Entry<String, BugfixStats.AuthorBugfixStats> e) -> e.getValue().getBugfixRatio()).reversed());

        Map<String, BugfixStats.AuthorBugfixStats> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }

    private static String mostReliableAuthor(Map<String, BugfixStats.AuthorBugfixStats> byAuthor) {
        String best = null;
        double bestScore = -1;
        for (Map.Entry<String, BugfixStats.AuthorBugfixStats> entry : byAuthor.entrySet()) {
            if (entry.getValue().getQualityScore() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue().getQualityScore();
            }
        }
        return best;
    }

    private static BugfixStats.TimePatterns timePatterns(List<Commit> bugfixes) {
        if (bugfixes.isEmpty()) {
            return null;
        }
        Map<Integer, Integer> byHour = new LinkedHashMap<>();
        Map<String, Integer> byDay = new LinkedHashMap<>();
        Map<String, Integer> byMonth = new TreeMap<>();
        Map<String, Integer> urgency = new LinkedHashMap<>();
        Map<String, Integer> severity = new LinkedHashMap<>();
        for (Commit commit : bugfixes) {
            byHour.merge(commit.getTimestamp().getHour(), 1, Integer::sum);
            byDay.merge(commit.getTimestamp().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH), 1, Integer::sum);
            byMonth.merge(commit.getTimestamp().format(MONTH_FORMAT), 1, Integer::sum);

            String message = commit.getSubject().toLowerCase(Locale.ROOT);
            URGENT_KEYWORDS.stream().filter(message::contains).forEach(k -> urgency.merge(k, 1, Integer::sum));
            SEVERITY_KEYWORDS.stream().filter(message::contains).forEach(k -> severity.merge(k, 1, Integer::sum));
        }
        int urgent = urgency.values().stream().mapToInt(Integer::intValue).sum();

        return BugfixStats.TimePatterns.builder()
                .byHourOfDay(byHour)
                .byDayOfWeek(byDay)
                .byMonth(byMonth)
                .peakBugfixHour(Statistics.firstMaxKey(byHour))
                .peakBugfixDay(Statistics.firstMaxKey(byDay))
                .urgencyKeywords(urgency)
                .severityKeywords(severity)
                .urgentFixes(urgent)
                .urgentRatio(ratio(urgent, bugfixes.size()))
                .build();
    }

    /**
     * Percent change of monthly bugfix counts between the older and newer half of the months.
     * Positive means bugfixes are increasing.
     */
    static double bugfixTrend(Map<String, Integer> chronologicalMonths) {
        if (chronologicalMonths.size() < 2) {
            return 0.0;
        }
        List<Integer> counts = new ArrayList<>(chronologicalMonths.values());
        int half = counts.size() / 2;
        double firstAvg = Statistics.mean(counts.subList(0, half));
        double secondAvg = Statistics.mean(counts.subList(counts.size() - half, counts.size()));
        if (firstAvg == 0) {
            return 0.0;
        }
        return Statistics.round((secondAvg - firstAvg) / firstAvg * 100, 1);
    }

    static double ratio(int count, int total) {
        return Statistics.round(Statistics.percentage(count, total), 2);
    }

    static double qualityScore(int bugfixes, int features) {
        int productive = bugfixes + features;
        if (productive == 0) {
            return 1.0;
        }
        return Statistics.round((double) features / productive, 3);
    }
}
