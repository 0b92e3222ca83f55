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

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deployment cadence from production tags and merges into a main-like branch.
 */
@Component
@RequiredArgsConstructor
public class DeploymentFrequencyMetric extends AbstractGitMetric {

    static final int RECENT_DEPLOYMENTS = 20;
    static final List<String> MAIN_BRANCH_NAMES = List.of("main", "master", "production", "prod");
    static final List<Pattern> MERGE_PATTERNS = List.of(
            Pattern.compile("^Merge pull request", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Merge branch", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Merge remote-tracking branch", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^Merged in", Pattern.CASE_INSENSITIVE));

    private static final List<String> SUCCESS_KEYWORDS =
            List.of("success", "successful", "deploy", "deployed", "release", "released");
    private static final List<String> FAILURE_KEYWORDS =
            List.of("rollback", "revert", "failed", "error", "issue", "problem");
    private static final Set<String> WEEKDAYS = Set.of("Monday", "Tuesday", "Wednesday", "Thursday", "Friday");
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final ProductionTagMatcher tagMatcher;

    @Override
    public String getName() {
        return "deployment_frequency";
    }

    @Override
    public MetricCategory getCategory() {
        return MetricCategory.FLOW;
    }

    @Override
    public String getDescription() {
        return "Measures deployment frequency and release cadence patterns";
    }

    @Override
    public String getDataPointsLabel() {
        return "deployments";
    }

    @Override
    protected MetricComputation compute(MetricInput input) {
        List<Commit> commits = input.getCommits();
        if (commits.isEmpty() && input.getTags().isEmpty()) {
            return MetricComputation.empty(MetricValue.Summary.empty());
        }

        List<Deployment> deployments = identifyDeployments(input.getTags(), commits, input.getBranches());
        Instant reference = input.getWindow() == null ? null : input.getWindow().getEnd();

        DeploymentFrequencyStats stats = DeploymentFrequencyStats.builder()
                .overall(overall(deployments, reference))
                .deployments(new ArrayList<>(deployments.subList(0, Math.min(RECENT_DEPLOYMENTS, deployments.size()))))
                .patterns(patterns(deployments))
                .stability(stability(deployments))
                .trends(trends(deployments))
                .quality(quality(deployments, commits.size()))
                .build();

        return MetricComputation.builder()
                .value(new MetricValue.Summary<>(stats))
                .dataPoints(deployments.size())
                .meta("total_deployments", stats.getOverall().getTotalDeployments())
                .meta("deployments_per_week", stats.getOverall().getDeploymentsPerWeek())
                .meta("avg_days_between", stats.getOverall().getAvgDaysBetweenDeployments())
                .meta("deployment_consistency", stats.getStability().getConsistencyScore())
                .meta("deployment_velocity", stats.getQuality() == null ? null : stats.getQuality().getDeploymentVelocity())
                .meta("last_deployment_days_ago", stats.getOverall().getDaysSinceLastDeployment())
                .build();
    }

    /**
     * Production tags and main-branch merges, at most one per calendar day, newest first.
     */
    List<Deployment> identifyDeployments(List<Tag> tags, List<Commit> commits, List<String> branches) {
        List<Deployment> candidates = new ArrayList<>();
        for (Tag tag : tagMatcher.filterProductionTags(tags)) {
            if (!tag.isDated()) {
                continue;
            }
            candidates.add(Deployment.builder()
                    .type(Deployment.DeploymentType.PRODUCTION_RELEASE)
                    .identifier(tag.getName())
                    .timestamp(tag.getTimestamp())
                    .commitHash(tag.getCommitHash())
                    .method("tag")
                    .build());
        }
        if (hasMainBranch(branches)) {
            commits.stream()
                    .filter(commit -> isMergeCommit(commit.getSubject()))
                    .forEach(commit -> candidates.add(Deployment.builder()
                            .type(Deployment.DeploymentType.MERGE_DEPLOYMENT)
                            .identifier(commit.getShortHash())
                            .timestamp(commit.getTimestamp())
                            .commitHash(commit.getHash())
                            .method("merge")
                            .message(commit.getSubject())
                            .build()));
        }

        List<Deployment> unique = deduplicateByDay(candidates);
        unique.sort(Comparator.comparing(Deployment::getInstant).reversed());
        return unique;
    }

    static boolean hasMainBranch(List<String> branches) {
        if (branches.isEmpty()) {
            return true;
        }
        return branches.stream().anyMatch(branch -> MAIN_BRANCH_NAMES.stream().anyMatch(branch::contains));
    }

    static boolean isMergeCommit(String subject) {
        if (subject == null) {
            return false;
        }
        String trimmed = subject.strip();
        return MERGE_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(trimmed).find());
    }

    /**
     * Keeps one deployment per calendar day: the production release when there is one,
     * otherwise the latest merge.
     */
    static List<Deployment> deduplicateByDay(List<Deployment> deployments) {
        Map<String, List<Deployment>> byDay = new LinkedHashMap<>();
        deployments.forEach(d -> byDay.computeIfAbsent(d.getTimestamp().format(DAY_FORMAT), k -> new ArrayList<>()).add(d));

        List<Deployment> result = new ArrayList<>();
        for (List<Deployment> day : byDay.values()) {
            Optional<Deployment> release = day.stream()
                    .filter(d -> d.getType() == Deployment.DeploymentType.PRODUCTION_RELEASE)
                    .findFirst();
            if (release.isPresent()) {
                result.add(release.get());
                continue;
            }
            day.stream()
                    .filter(d -> d.getType() == Deployment.DeploymentType.MERGE_DEPLOYMENT)
                    .max(Comparator.comparing(Deployment::getInstant))
                    .ifPresent(result::add);
        }
        return result;
    }

    private static DeploymentFrequencyStats.Overall overall(List<Deployment> deployments, Instant reference) {
        if (deployments.isEmpty()) {
            return DeploymentFrequencyStats.Overall.builder().frequencyCategory("none").build();
        }
        List<Instant> dates = sortedInstants(deployments);
        Instant first = dates.get(0);
        Instant last = dates.get(dates.size() - 1);

        double daysSpan = Math.max(Statistics.round(days(first, last), 1), 1.0);
        double perDay = Statistics.round(deployments.size() / daysSpan, 3);
        double perWeek = Statistics.round(perDay * 7, 2);
        List<Double> intervals = intervals(dates);

        return DeploymentFrequencyStats.Overall.builder()
                .totalDeployments(deployments.size())
                .daysSpan(daysSpan)
                .deploymentsPerDay(perDay)
                .deploymentsPerWeek(perWeek)
                .deploymentsPerMonth(Statistics.round(perDay * 30, 2))
                .avgDaysBetweenDeployments(Statistics.round(Statistics.mean(intervals), 2))
                .minDaysBetween(intervals.isEmpty() ? 0.0 : Collections.min(intervals))
                .maxDaysBetween(intervals.isEmpty() ? 0.0 : Collections.max(intervals))
                .daysSinceLastDeployment(reference == null ? 0.0 : Statistics.round(days(last, reference), 1))
                .frequencyCategory(frequencyCategory(perWeek))
                .build();
    }

    private static DeploymentFrequencyStats.Patterns patterns(List<Deployment> deployments) {
        Map<Integer, Integer> byHour = new LinkedHashMap<>();
        Map<String, Integer> byWeekday = new LinkedHashMap<>();
        Map<String, Integer> byMonth = new LinkedHashMap<>();
        Map<Deployment.DeploymentType, Integer> byType = new EnumMap<>(Deployment.DeploymentType.class);
        for (Deployment deployment : deployments) {
            byHour.merge(deployment.getTimestamp().getHour(), 1, Integer::sum);
            byWeekday.merge(deployment.getTimestamp().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH), 1, Integer::sum);
            byMonth.merge(deployment.getTimestamp().format(MONTH_FORMAT), 1, Integer::sum);
            byType.merge(deployment.getType(), 1, Integer::sum);
        }
        int total = deployments.size();
        int workingHours = byHour.entrySet().stream()
                .filter(e -> e.getKey() >= 9 && e.getKey() <= 18)
                .mapToInt(Map.Entry::getValue)
                .sum();
        int weekdays = byWeekday.entrySet().stream()
                .filter(e -> WEEKDAYS.contains(e.getKey()))
                .mapToInt(Map.Entry::getValue)
                .sum();

        return DeploymentFrequencyStats.Patterns.builder()
                .byHourOfDay(byHour)
                .byDayOfWeek(byWeekday)
                .byMonth(byMonth)
                .byDeploymentType(byType)
                .peakDeploymentHour(Statistics.firstMaxKey(byHour))
                .peakDeploymentDay(Statistics.firstMaxKey(byWeekday))
                .workingHoursRatio(total == 0 ? 0.0 : Statistics.round((double) workingHours / total, 3))
                .weekdayRatio(total == 0 ? 0.0 : Statistics.round((double) weekdays / total, 3))
                .build();
    }

    static DeploymentFrequencyStats.Stability stability(List<Deployment> deployments) {
        List<Double> intervals = intervals(sortedInstants(deployments));
        if (intervals.isEmpty()) {
            return DeploymentFrequencyStats.Stability.builder().deploymentPredictability("unknown").build();
        }
        // same-instant deployments carry no cadence
        double cov = Statistics.mean(intervals) > 0 ? Statistics.coefficientOfVariation(intervals) : 1.0;
        double consistency = Statistics.round(Math.max(1.0 - cov, 0.0), 3);
        return DeploymentFrequencyStats.Stability.builder()
                .consistencyScore(consistency)
                .coefficientOfVariation(Statistics.round(cov, 3))
                .stdDeviationDays(Statistics.round(Statistics.standardDeviation(intervals), 2))
                .deploymentPredictability(predictability(consistency))
                .longestGapDays(Collections.max(intervals))
                .shortestGapDays(Collections.min(intervals))
                .build();
    }

    private static DeploymentFrequencyStats.Trends trends(List<Deployment> deployments) {
        if (deployments.size() < 4) {
            return null;
        }
        Map<String, Integer> monthly = new TreeMap<>();
        deployments.forEach(d -> monthly.merge(d.getTimestamp().format(MONTH_FORMAT), 1, Integer::sum));
        if (monthly.size() < 3) {
            return null;
        }
        List<Integer> counts = new ArrayList<>(monthly.values());
        int half = counts.size() / 2;
        double firstAvg = Statistics.mean(counts.subList(0, half));
        double secondAvg = Statistics.mean(counts.subList(counts.size() - half, counts.size()));

        String direction;
        if (firstAvg == 0 || Math.abs(secondAvg - firstAvg) < 0.1) {
            direction = "stable";
        } else {
            direction = secondAvg > firstAvg ? "increasing" : "decreasing";
        }

        String leastActive = null;
        int leastCount = Integer.MAX_VALUE;
        for (Map.Entry<String, Integer> entry : monthly.entrySet()) {
            if (entry.getValue() < leastCount) {
                leastActive = entry.getKey();
                leastCount = entry.getValue();
            }
        }

        return DeploymentFrequencyStats.Trends.builder()
                .monthlyCounts(monthly)
                .trendDirection(direction)
                .trendPercentage(firstAvg > 0 ? Statistics.round((secondAvg - firstAvg) / firstAvg * 100, 1) : 0.0)
                .mostActiveMonth(Statistics.firstMaxKey(monthly))
                .leastActiveMonth(leastActive)
                .build();
    }

    private static DeploymentFrequencyStats.Quality quality(List<Deployment> deployments, int totalCommits) {
        if (deployments.isEmpty() || totalCommits == 0) {
            return null;
        }
        double commitsPerDeployment = (double) totalCommits / deployments.size();
        int successes = 0;
        int failures = 0;
        for (Deployment deployment : deployments) {
            String message = deployment.getMessage() == null ? "" : deployment.getMessage().toLowerCase(Locale.ROOT);
            if (SUCCESS_KEYWORDS.stream().anyMatch(message::contains)) {
                successes++;
            }
            if (FAILURE_KEYWORDS.stream().anyMatch(message::contains)) {
                failures++;
            }
        }

        double deploymentsPerWeek = Statistics.round(deployments.size() / (totalCommits / 7.0), 3);
        double frequencyScore = Math.min(deploymentsPerWeek, 5.0) / 5.0;
        double batchScore = Math.min(20.0 / Math.max(commitsPerDeployment, 1.0), 1.0);

        double rounded = Statistics.round(commitsPerDeployment, 2);
        return DeploymentFrequencyStats.Quality.builder()
                .commitsPerDeployment(rounded)
                .deploymentVelocity(velocity(rounded))
                .batchSizeCategory(batchSize(rounded))
                .apparentSuccesses(successes)
                .apparentFailures(failures)
                .successRate(successRate(successes, failures, deployments.size()))
                .deploymentEfficiency(Statistics.round((frequencyScore + batchScore) / 2, 3))
                .build();
    }

    /**
     * Share of successes among deployments with an indicator; without indicators
     * every deployment counts as successful.
     */
    static double successRate(int successes, int failures, int total) {
        if (total == 0) {
            return 0.0;
        }
        if (successes > 0 || failures > 0) {
            return Statistics.round(Statistics.percentage(successes, successes + failures), 2);
        }
        return 100.0;
    }

    static String frequencyCategory(double deploymentsPerWeek) {
        if (deploymentsPerWeek == 0) {
            return "none";
        }
        if (deploymentsPerWeek <= 0.25) {
            return "low";
        }
        if (deploymentsPerWeek <= 1) {
            return "moderate";
        }
        if (deploymentsPerWeek <= 3) {
            return "high";
        }
        return "very_high";
    }

    static String predictability(double consistencyScore) {
        if (consistencyScore >= 0.8) {
            return "highly_predictable";
        }
        if (consistencyScore >= 0.6) {
            return "moderately_predictable";
        }
        if (consistencyScore >= 0.4) {
            return "somewhat_predictable";
        }
        return "unpredictable";
    }

    static String velocity(double commitsPerDeployment) {
        if (commitsPerDeployment <= 5) {
            return "small_batches";
        }
        if (commitsPerDeployment <= 20) {
            return "medium_batches";
        }
        if (commitsPerDeployment <= 50) {
            return "large_batches";
        }
        return "very_large_batches";
    }

    static String batchSize(double commitsPerDeployment) {
        if (commitsPerDeployment <= 1) {
            return "SINGLE_COMMIT";
        }
        if (commitsPerDeployment <= 5) {
            return "SMALL_BATCH";
        }
        if (commitsPerDeployment <= 15) {
            return "MEDIUM_BATCH";
        }
        if (commitsPerDeployment <= 30) {
            return "LARGE_BATCH";
        }
        return "VERY_LARGE_BATCH";
    }

    private static List<Instant> sortedInstants(List<Deployment> deployments) {
        return deployments.stream().map(Deployment::getInstant).sorted().collect(Collectors.toList());
    }

    /**
     * Gaps between consecutive sorted instants in days, rounded to 2 places.
     */
    static List<Double> intervals(List<Instant> sorted) {
        List<Double> result = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            result.add(Statistics.round(days(sorted.get(i - 1), sorted.get(i)), 2));
        }
        return result;
    }

    private static double days(Instant from, Instant to) {
        return Duration.between(from, to).getSeconds() / SECONDS_PER_DAY;
    }
}
