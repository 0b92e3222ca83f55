package eu.devmetrics.app.metrics.reliability;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.util.Statistics;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.format.TextStyle;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Share of commits that revert, or were reverted by, other commits.
 */
@Component
public class RevertRateMetric extends AbstractGitMetric {

    static final double HIGH_RISK_REVERTED_RATE = 5.0;
    static final int RECENT_LIMIT = 10;

    static final List<Pattern> REVERT_PATTERNS = List.of(
            Pattern.compile("^Revert\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^This reverts commit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("reverts?\\s+commit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Rollback", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Undo\\s+", Pattern.CASE_INSENSITIVE));

    private static final Pattern HASH_PATTERN = Pattern.compile("([a-f0-9]{7,40})", Pattern.CASE_INSENSITIVE);

    // Checked in order, first match wins.
    private static final Map<String, Pattern> REASONS = new LinkedHashMap<>();

    static {
        REASONS.put("Bug fixes", Pattern.compile("bug|error|fix|issue|problem"));
        REASONS.put("Test issues", Pattern.compile("test|spec|failing"));
        REASONS.put("Breaking changes", Pattern.compile("break|broken|regression"));
        REASONS.put("Performance issues", Pattern.compile("performance|slow|timeout"));
        REASONS.put("Security concerns", Pattern.compile("security|vulnerability"));
    }

    @Override
    public String getName() {
        return "revert_rate";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.RELIABILITY;
    }

    @Override
    public String getDescription() {
        return "Analyzes commit revert patterns to identify code quality issues";
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

        List<Commit> reverts = commits.stream()
                .filter(commit -> isRevert(commit.getSubject()))
                .collect(Collectors.toList());
        List<Commit> reverted = revertedCommits(commits, reverts);
        Map<String, RevertStats.AuthorRevertStats> byAuthor = authorStats(commits, reverts, reverted);

        int total = commits.size();
        RevertStats stats = RevertStats.builder()
                .totalCommits(total)
                .revertCommits(reverts.size())
                .revertedCommits(reverted.size())
                .revertRate(rate(reverts.size(), total))
                .revertedRate(rate(reverted.size(), total))
                .stabilityScore(stability(reverted.size(), total))
                .byAuthor(byAuthor)
                .recentReverts(new ArrayList<>(reverts.subList(0, Math.min(RECENT_LIMIT, reverts.size()))))
                .recentReverted(new ArrayList<>(reverted.subList(0, Math.min(RECENT_LIMIT, reverted.size()))))
                .revertReasons(revertReasons(reverts))
                .timePatterns(timePatterns(reverts))
                .build();

        return MetricComputation.builder()
                .value(new MetricValue.Summary<>(stats))
                .dataPoints(total)
                .meta("total_commits", total)
                .meta("revert_rate", stats.getRevertRate())
                .meta("stability_score", stats.getStabilityScore())
                .meta("high_risk_authors", byAuthor.values().stream()
                        .filter(author -> author.getRevertedRate() > HIGH_RISK_REVERTED_RATE).count())
                .meta("most_reverted_author", byAuthor.isEmpty() ? null : byAuthor.keySet().iterator().next())
                .meta("revert_frequency", revertFrequency(stats.getRecentReverts()))
                .build();
    }

    static boolean isRevert(String subject) {
        if (subject == null) {
            return false;
        }
        String trimmed = subject.strip();
        return REVERT_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(trimmed).find());
    }

    /**
     * Commits whose hash starts with a hash quoted in a revert subject.
     */
    static List<Commit> revertedCommits(List<Commit> commits, List<Commit> reverts) {
        Set<String> referenced = new HashSet<>();
        for (Commit revert : reverts) {
            Matcher matcher = HASH_PATTERN.matcher(revert.getSubject());
            if (matcher.find()) {
                referenced.add(matcher.group(1).toLowerCase(Locale.ROOT));
            }
        }
        if (referenced.isEmpty()) {
            return new ArrayList<>();
        }
        return commits.stream()
                .filter(commit -> {
                    String hash = commit.getHash().toLowerCase(Locale.ROOT);
                    return referenced.stream().anyMatch(hash::startsWith);
                })
                .collect(Collectors.toList());
    }

    private static Map<String, RevertStats.AuthorRevertStats> authorStats(List<Commit> commits, List<Commit> reverts,
                                                                          List<Commit> reverted) {
        Map<String, Integer> totals = countByAuthor(commits);
        Map<String, Integer> made = countByAuthor(reverts);
        Map<String, Integer> suffered = countByAuthor(reverted);

        List<Map.Entry<String, RevertStats.AuthorRevertStats>> entries = new ArrayList<>();
        totals.forEach((author, total) -> {
            int revertsMade = made.getOrDefault(author, 0);
            int commitsReverted = suffered.getOrDefault(author, 0);
            entries.add(Map.entry(author, RevertStats.AuthorRevertStats.builder()
                    .totalCommits(total)
                    .revertsMade(revertsMade)
                    .commitsReverted(commitsReverted)
                    .revertRate(rate(revertsMade, total))
                    .revertedRate(rate(commitsReverted, total))
                    .reliabilityScore(stability(commitsReverted, total))
                    .build()));
        });
        entries.sort(Comparator.comparingDouble(
                (Map.Entry<String, RevertStats.AuthorRevertStats> e) -> e.getValue().getRevertedRate()).reversed());

        Map<String, RevertStats.AuthorRevertStats> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }

    private static Map<String, Integer> countByAuthor(List<Commit> commits) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        commits.forEach(commit -> counts.merge(commit.getAuthorName(), 1, Integer::sum));
        return counts;
    }

    static Map<String, Integer> revertReasons(List<Commit> reverts) {
        Map<String, Integer> reasons = new LinkedHashMap<>();
        for (Commit revert : reverts) {
            String message = revert.getSubject().toLowerCase(Locale.ROOT);
            String reason = REASONS.entrySet().stream()
                    .filter(entry -> entry.getValue().matcher(message).find())
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse("Other");
            reasons.merge(reason, 1, Integer::sum);
        }
        return reasons;
    }

    private static RevertStats.TimePatterns timePatterns(List<Commit> reverts) {
        if (reverts.isEmpty()) {
            return null;
        }
        Map<Integer, Integer> byHour = new LinkedHashMap<>();
        Map<String, Integer> byDay = new LinkedHashMap<>();
        for (Commit revert : reverts) {
            byHour.merge(revert.getTimestamp().getHour(), 1, Integer::sum);
            byDay.merge(revert.getTimestamp().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH), 1, Integer::sum);
        }
        return RevertStats.TimePatterns.builder()
                .byHourOfDay(byHour)
                .byDayOfWeek(byDay)
                .peakRevertHour(Statistics.firstMaxKey(byHour))
                .peakRevertDay(Statistics.firstMaxKey(byDay))
                .build();
    }

    /**
     * Average days between the given reverts, rounded to 1 place; 0 with fewer than two.
     */
    static double revertFrequency(List<Commit> reverts) {
        if (reverts.size() < 2) {
            return 0.0;
        }
        List<Instant> dates = reverts.stream().map(Commit::getInstant).sorted().collect(Collectors.toList());
        List<Double> intervals = new ArrayList<>();
        for (int i = 1; i < dates.size(); i++) {
            intervals.add(Duration.between(dates.get(i - 1), dates.get(i)).getSeconds() / 86_400.0);
        }
        return Statistics.round(Statistics.mean(intervals), 1);
    }

    static double rate(int count, int total) {
        return Statistics.round(Statistics.percentage(count, total), 2);
    }

    static double stability(int reverted, int total) {
        if (total == 0) {
            return 1.0;
        }
        return Statistics.round(Math.max(1.0 - (double) reverted / total, 0.0), 3);
    }
}
