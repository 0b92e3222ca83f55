package eu.devmetrics.app.metrics.activity;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.util.Statistics;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.*;

/**
 * Commit frequency patterns by day, hour and weekday.
 * Buckets use each commit's own UTC offset.
 */
@Component
public class CommitFrequencyMetric extends AbstractGitMetric {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final int WORKING_HOURS_START = 9;
    private static final int WORKING_HOURS_END = 18;

    @Override
    public String getName() {
        return "commit_frequency";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.COMMIT_ACTIVITY;
    }

    @Override
    public String getDescription() {
        return "Analysis of commit frequency patterns by hour, day, and week";
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

        Map<String, Integer> daily = countByDay(commits);
        Map<Integer, Integer> hourly = countByHour(commits);

        CommitFrequencyStats stats = CommitFrequencyStats.builder()
                .totalCommits(commits.size())
                .commitsPerDay(CommitFrequencyStats.DailyCounts.builder()
                        .byDate(daily)
                        .average(Statistics.round(Statistics.mean(daily.values()), 2))
                        .max(Collections.max(daily.values()))
                        .min(Collections.min(daily.values()))
                        .build())
                .commitsPerHour(hourly)
                .commitsPerWeekday(countByWeekday(commits))
                .workingHours(workingHoursSplit(commits))
                .busiestDay(busiestDay(daily))
                .busiestHour(Statistics.firstMaxKey(hourly) + ":00")
                .consistencyScore(consistencyScore(daily))
                .build();

        OffsetDateTime first = commits.stream().map(Commit::getTimestamp)
                .min(Comparator.comparing(OffsetDateTime::toInstant)).orElseThrow();
        OffsetDateTime last = commits.stream().map(Commit::getTimestamp)
                .max(Comparator.comparing(OffsetDateTime::toInstant)).orElseThrow();
        double spanDays = Duration.between(first, last).getSeconds() / 86_400.0;

        return MetricComputation.builder()
                .value(new MetricValue.Summary<>(stats))
                .dataPoints(commits.size())
                .meta("time_span_days", Statistics.round(spanDays, 1))
                .meta("first_commit", first)
                .meta("last_commit", last)
                .meta("average_commits_per_day", Statistics.round(commits.size() / Math.max(spanDays, 1.0), 2))
                .build();
    }

    /**
     * {@code max(0, 100 - CoV(daily counts) * 50)}, 100 when there is a single day.
     */
    static double consistencyScore(Map<String, Integer> dailyCounts) {
        if (dailyCounts.isEmpty()) {
            return 0.0;
        }
        if (dailyCounts.size() == 1) {
            return 100.0;
        }
        double cov = Statistics.coefficientOfVariation(dailyCounts.values());
        return Statistics.round(Math.max(100.0 - cov * 50.0, 0.0), 1);
    }

    static boolean isWorkingHours(OffsetDateTime timestamp) {
        DayOfWeek day = timestamp.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        int hour = timestamp.getHour();
        return hour >= WORKING_HOURS_START && hour < WORKING_HOURS_END;
    }

    private static Map<String, Integer> countByDay(List<Commit> commits) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Commit commit : commits) {
            counts.merge(DAY_FORMAT.format(commit.getTimestamp()), 1, Integer::sum);
        }
        return counts;
    }

    private static Map<Integer, Integer> countByHour(List<Commit> commits) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (int hour = 0; hour < 24; hour++) {
            counts.put(hour, 0);
        }
        for (Commit commit : commits) {
            counts.merge(commit.getTimestamp().getHour(), 1, Integer::sum);
        }
        return counts;
    }

    private static Map<String, Integer> countByWeekday(List<Commit> commits) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Commit commit : commits) {
            String weekday = commit.getTimestamp().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            counts.merge(weekday, 1, Integer::sum);
        }
        return counts;
    }

    private static CommitFrequencyStats.WorkingHoursSplit workingHoursSplit(List<Commit> commits) {
        int working = (int) commits.stream().filter(c -> isWorkingHours(c.getTimestamp())).count();
        int off = commits.size() - working;
        return CommitFrequencyStats.WorkingHoursSplit.builder()
                .workingHours(working)
                .offHours(off)
                .workingHoursPercentage(Statistics.round(Statistics.percentage(working, commits.size()), 1))
                .offHoursPercentage(Statistics.round(Statistics.percentage(off, commits.size()), 1))
                .build();
    }

    private static CommitFrequencyStats.BusiestDay busiestDay(Map<String, Integer> daily) {
        String date = Statistics.firstMaxKey(daily);
        return new CommitFrequencyStats.BusiestDay(date, daily.get(date));
    }
}
