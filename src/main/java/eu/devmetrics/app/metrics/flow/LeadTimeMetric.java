package eu.devmetrics.app.metrics.flow;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.git.ProductionTagMatcher;
import eu.devmetrics.app.git.Tag;
import eu.devmetrics.app.metrics.AbstractGitMetric;
import eu.devmetrics.app.metrics.MetricCategory;
import eu.devmetrics.app.metrics.MetricComputation;
import eu.devmetrics.app.metrics.MetricInput;
import eu.devmetrics.app.metrics.MetricValue;
import eu.devmetrics.app.util.Statistics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Lead time from commit to the first production release published after it.
 */
@Component
@RequiredArgsConstructor
public class LeadTimeMetric extends AbstractGitMetric {

    static final double ACCEPTABLE_LEAD_TIME_HOURS = 168;
    static final int TREND_MIN_COMMITS = 10;
    static final int MAX_BOTTLENECK_COMMITS = 20;
    static final int RECENT_RELEASES = 10;

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final ProductionTagMatcher tagMatcher;

    @Override
    public String getName() {
        return "lead_time";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.FLOW;
    }

    @Override
    public String getDescription() {
        return "Measures lead time from code commit to production deployment";
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

        List<Tag> releases = productionReleases(input.getTags());
        List<CommitLeadTime> leadTimes = commitLeadTimes(commits, releases);
        List<Double> hours = leadTimes.stream().map(CommitLeadTime::getLeadTimeHours).collect(Collectors.toList());
        List<Double> sorted = Statistics.sorted(hours);

        List<Tag> recent = new ArrayList<>(releases);
        Collections.reverse(recent);

        LeadTimeStats stats = LeadTimeStats.builder()
                .overall(LeadTimeStats.Overall.builder()
                        .totalCommits(commits.size())
                        .commitsWithLeadTime(hours.size())
                        .avgLeadTimeHours(Statistics.round(Statistics.mean(hours), 2))
                        .medianLeadTimeHours(Statistics.round(Statistics.median(hours), 2))
                        .p95LeadTimeHours(Statistics.percentile(sorted, 95))
                        .minLeadTimeHours(sorted.isEmpty() ? 0.0 : sorted.get(0))
                        .maxLeadTimeHours(sorted.isEmpty() ? 0.0 : sorted.get(sorted.size() - 1))
                        .flowEfficiency(flowEfficiency(hours))
                        .build())
                .byAuthor(authorLeadTimes(commits, leadTimes))
                .productionReleases(new ArrayList<>(recent.subList(0, Math.min(RECENT_RELEASES, recent.size()))))
                .distribution(distribution(sorted))
                .bottlenecks(bottlenecks(leadTimes, sorted))
                .trends(trends(leadTimes))
                .build();

        return MetricComputation.builder()
                .value(new MetricValue.Summary<>(stats))
                .dataPoints(commits.size())
                .meta("avg_lead_time_hours", stats.getOverall().getAvgLeadTimeHours())
                .meta("median_lead_time_hours", stats.getOverall().getMedianLeadTimeHours())
                .meta("flow_efficiency", stats.getOverall().getFlowEfficiency())
                .meta("fast_authors", stats.getByAuthor().values().stream()
                        .filter(author -> author.getAvgLeadTimeHours() < 24).count())
                .meta("slowest_author", slowestAuthor(stats.getByAuthor()))
                .meta("bottleneck_count", stats.getBottlenecks() == null
                        ? 0 : stats.getBottlenecks().getHighLeadTimeCommits().size())
                .build();
    }

    /**
     * Dated production tags, oldest first.
     */
    List<Tag> productionReleases(List<Tag> tags) {
        return tagMatcher.filterProductionTags(tags).stream()
                .filter(Tag::isDated)
                .sorted(Comparator.comparing(tag -> tag.getTimestamp().toInstant()))
                .collect(Collectors.toList());
    }

    /**
     * Pairs every commit with the earliest release strictly after it. Commits never released are left out.
     *
     * @param releases production releases sorted oldest first
     */
    static List<CommitLeadTime> commitLeadTimes(List<Commit> commits, List<Tag> releases) {
        List<CommitLeadTime> result = new ArrayList<>();
        if (releases.isEmpty()) {
            return result;
        }
        for (Commit commit : commits) {
            Optional<Tag> release = releases.stream()
                    .filter(tag -> tag.getTimestamp().toInstant().isAfter(commit.getInstant()))
                    .findFirst();
            if (release.isEmpty()) {
                continue;
            }
            Tag tag = release.get();
            double hours = Duration.between(commit.getInstant(), tag.getTimestamp().toInstant()).getSeconds() / 3600.0;
            double rounded = Statistics.round(hours, 2);
            result.add(CommitLeadTime.builder()
                    .hash(commit.getHash())
                    .author(commit.getAuthorName())
                    .commitDate(commit.getTimestamp())
                    .subject(commit.getSubject())
                    .leadTimeHours(rounded)
                    .leadTimeDays(Statistics.round(rounded / 24.0, 2))
                    .deployedInRelease(tag.getName())
                    .deploymentDate(tag.getTimestamp())
                    .build());
        }
        return result;
    }

    static double flowEfficiency(List<Double> hours) {
        if (hours.isEmpty()) {
            return 1.0;
        }
        long fast = hours.stream().filter(h -> h <= ACCEPTABLE_LEAD_TIME_HOURS).count();
        return Statistics.round((double) fast / hours.size(), 3);
    }

    private static Map<String, LeadTimeStats.AuthorLeadTime> authorLeadTimes(List<Commit> commits,
                                                                             List<CommitLeadTime> leadTimes) {
        Map<String, Integer> totalByAuthor = new HashMap<>();
        commits.forEach(commit -> totalByAuthor.merge(commit.getAuthorName(), 1, Integer::sum));

        Map<String, List<Double>> hoursByAuthor = new LinkedHashMap<>();
        leadTimes.forEach(lt -> hoursByAuthor.computeIfAbsent(lt.getAuthor(), k -> new ArrayList<>())
                .add(lt.getLeadTimeHours()));

        List<Map.Entry<String, LeadTimeStats.AuthorLeadTime>> entries = new ArrayList<>();
        hoursByAuthor.forEach((author, hours) -> {
            int total = totalByAuthor.getOrDefault(author, hours.size());
            entries.add(Map.entry(author, LeadTimeStats.AuthorLeadTime.builder()
                    .totalCommits(total)
                    .commitsDeployed(hours.size())
                    .avgLeadTimeHours(Statistics.round(Statistics.mean(hours), 2))
                    .medianLeadTimeHours(Statistics.round(Statistics.median(hours), 2))
                    .minLeadTimeHours(Collections.min(hours))
                    .maxLeadTimeHours(Collections.max(hours))
                    .deploymentRate(Statistics.round(Statistics.percentage(hours.size(), total), 2))
                    .build()));
        });
        entries.sort(Comparator.comparingDouble(e -> e.getValue().getAvgLeadTimeHours()));

        Map<String, LeadTimeStats.AuthorLeadTime> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }

    static LeadTimeStats.Distribution distribution(List<Double> sorted) {
        if (sorted.isEmpty()) {
            return null;
        }
        return LeadTimeStats.Distribution.builder()
                .q1(Statistics.percentile(sorted, 25))
                .q2(Statistics.percentile(sorted, 50))
                .q3(Statistics.percentile(sorted, 75))
                .p50(Statistics.percentile(sorted, 50))
                .p75(Statistics.percentile(sorted, 75))
                .p90(Statistics.percentile(sorted, 90))
                .p95(Statistics.percentile(sorted, 95))
                .p99(Statistics.percentile(sorted, 99))
                .categories(categorize(sorted))
                .outliers(outliers(sorted))
                .build();
    }

    static Map<String, Integer> categorize(List<Double> hours) {
        Map<String, Integer> categories = new LinkedHashMap<>();
        categories.put("very_fast", 0);
        categories.put("fast", 0);
        categories.put("moderate", 0);
        categories.put("slow", 0);
        categories.put("very_slow", 0);
        for (double h : hours) {
            String category;
            if (h <= 4) {
                category = "very_fast";
            } else if (h <= 24) {
                category = "fast";
            } else if (h <= 168) {
                category = "moderate";
            } else if (h <= 672) {
                category = "slow";
            } else {
                category = "very_slow";
            }
            categories.merge(category, 1, Integer::sum);
        }
        return categories;
    }

    /**
     * Values outside {@code [Q1 - 1.5 IQR, Q3 + 1.5 IQR]}; needs at least four values.
     */
    static List<Double> outliers(List<Double> sorted) {
        if (sorted.size() < 4) {
            return Collections.emptyList();
        }
        double q1 = Statistics.percentile(sorted, 25);
        double q3 = Statistics.percentile(sorted, 75);
        double iqr = q3 - q1;
        double lower = q1 - 1.5 * iqr;
        double upper = q3 + 1.5 * iqr;
        return sorted.stream().filter(h -> h < lower || h > upper).collect(Collectors.toList());
    }

    private static LeadTimeStats.Bottlenecks bottlenecks(List<CommitLeadTime> leadTimes, List<Double> sorted) {
        if (leadTimes.isEmpty()) {
            return null;
        }
        double threshold = Statistics.percentile(sorted, 95);
        List<CommitLeadTime> slow = leadTimes.stream()
                .filter(lt -> lt.getLeadTimeHours() > threshold)
                .collect(Collectors.toList());

        Map<String, Integer> authors = new LinkedHashMap<>();
        slow.forEach(lt -> authors.merge(lt.getAuthor(), 1, Integer::sum));

        return LeadTimeStats.Bottlenecks.builder()
                .p95ThresholdHours(threshold)
                .highLeadTimeCommits(new ArrayList<>(slow.subList(0, Math.min(MAX_BOTTLENECK_COMMITS, slow.size()))))
                .commonFactors(sortByCountDesc(bottleneckFactors(slow)))
                .bottleneckAuthors(sortByCountDesc(authors))
                .build();
    }

    private static Map<String, Integer> bottleneckFactors(List<CommitLeadTime> slow) {
        Map<String, Integer> factors = new LinkedHashMap<>();
        for (CommitLeadTime lt : slow) {
            DayOfWeek day = lt.getCommitDate().getDayOfWeek();
            int hour = lt.getCommitDate().getHour();
            if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
                factors.merge("weekend_commits", 1, Integer::sum);
            }
            if (hour < 9 || hour > 18) {
                factors.merge("after_hours_commits", 1, Integer::sum);
            }
            if (day == DayOfWeek.FRIDAY) {
                factors.merge("friday_commits", 1, Integer::sum);
            }
            String message = lt.getSubject().toLowerCase(Locale.ROOT);
            if (message.contains("merge")) {
                factors.merge("merge_commits", 1, Integer::sum);
            }
            if (message.contains("fix")) {
                factors.merge("hotfix_commits", 1, Integer::sum);
            }
            if (message.length() > 100) {
                factors.merge("large_messages", 1, Integer::sum);
            }
            if (message.length() < 20) {
                factors.merge("vague_messages", 1, Integer::sum);
            }
        }
        return factors;
    }

    static LeadTimeStats.Trends trends(List<CommitLeadTime> leadTimes) {
        if (leadTimes.size() < TREND_MIN_COMMITS) {
            return null;
        }
        Map<String, List<Double>> byMonth = new TreeMap<>();
        leadTimes.forEach(lt -> byMonth.computeIfAbsent(MONTH_FORMAT.format(lt.getCommitDate()), k -> new ArrayList<>())
                .add(lt.getLeadTimeHours()));

        Map<String, Double> averages = new LinkedHashMap<>();
        byMonth.forEach((month, hours) -> averages.put(month, Statistics.mean(hours)));
        List<Double> ordered = new ArrayList<>(averages.values());

        return LeadTimeStats.Trends.builder()
                .monthlyAverages(averages)
                .trendDirection(trendDirection(ordered))
                .improvementRate(improvementRate(ordered))
                .build();
    }

    /**
     * Compares the average of the first half of the months with the second half.
     */
    static String trendDirection(List<Double> monthlyAverages) {
        int n = monthlyAverages.size();
        if (n < 2) {
            return "stable";
        }
        double first = Statistics.mean(monthlyAverages.subList(0, n / 2));
        double second = Statistics.mean(monthlyAverages.subList(n - n / 2, n));
        if (second < first * 0.9) {
            return "improving";
        }
        if (second > first * 1.1) {
            return "deteriorating";
        }
        return "stable";
    }

    static double improvementRate(List<Double> monthlyAverages) {
        if (monthlyAverages.size() < 2) {
            return 0.0;
        }
        double first = monthlyAverages.get(0);
        double last = monthlyAverages.get(monthlyAverages.size() - 1);
        if (first == 0.0) {
            return 0.0;
        }
        return Statistics.round((first - last) / first * 100.0, 1);
    }

    private static String slowestAuthor(Map<String, LeadTimeStats.AuthorLeadTime> byAuthor) {
        String slowest = null;
        double max = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, LeadTimeStats.AuthorLeadTime> entry : byAuthor.entrySet()) {
            if (entry.getValue().getAvgLeadTimeHours() > max) {
                slowest = entry.getKey();
                max = entry.getValue().getAvgLeadTimeHours();
            }
        }
        return slowest;
    }

    private static Map<String, Integer> sortByCountDesc(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }
}
