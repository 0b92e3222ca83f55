package eu.devmetrics.app.metrics.flow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Deployment cadence. {@code trends} is null with fewer than four deployments
 * or three distinct months; {@code quality} is null without commits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentFrequencyStats {
    private Overall overall;
    /** The twenty most recent deployments, newest first. */
    private List<Deployment> deployments;
    private Patterns patterns;
    private Stability stability;
    private Trends trends;
    private Quality quality;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Overall {
        private int totalDeployments;
        private double daysSpan;
        private double deploymentsPerDay;
        private double deploymentsPerWeek;
        private double deploymentsPerMonth;
        private double avgDaysBetweenDeployments;
        private double minDaysBetween;
        private double maxDaysBetween;
        /** Measured against the end of the analysis window. */
        private double daysSinceLastDeployment;
        /** none, low, moderate, high or very_high, by deployments per week. */
        private String frequencyCategory;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Patterns {
        private Map<Integer, Integer> byHourOfDay;
        private Map<String, Integer> byDayOfWeek;
        private Map<String, Integer> byMonth;
        private Map<Deployment.DeploymentType, Integer> byDeploymentType;
        private Integer peakDeploymentHour;
        private String peakDeploymentDay;
        private double workingHoursRatio;
        private double weekdayRatio;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stability {
        private double consistencyScore;
        private double coefficientOfVariation;
        private double stdDeviationDays;
        private String deploymentPredictability;
        private double longestGapDays;
        private double shortestGapDays;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Trends {
        private Map<String, Integer> monthlyCounts;
        /** increasing, decreasing or stable. */
        private String trendDirection;
        private double trendPercentage;
        private String mostActiveMonth;
        private String leastActiveMonth;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Quality {
        private double commitsPerDeployment;
        private String deploymentVelocity;
        private String batchSizeCategory;
        private int apparentSuccesses;
        private int apparentFailures;
        private double successRate;
        private double deploymentEfficiency;
    }
}
