package eu.devmetrics.app.metrics.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Commit counts bucketed by day, hour and weekday.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitFrequencyStats {
    private int totalCommits;
    private DailyCounts commitsPerDay;
    /** Hour of day (0-23, all present) to count. */
    private Map<Integer, Integer> commitsPerHour;
    /** Weekday name to count, in order of first appearance. */
    private Map<String, Integer> commitsPerWeekday;
    private WorkingHoursSplit workingHours;
    private BusiestDay busiestDay;
    /** Formatted as {@code H:00}. */
    private String busiestHour;
    private double consistencyScore;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyCounts {
        /** {@code yyyy-MM-dd} to count, in order of first appearance. */
        private Map<String, Integer> byDate;
        private double average;
        private int max;
        private int min;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkingHoursSplit {
        private int workingHours;
        private int offHours;
        private double workingHoursPercentage;
        private double offHoursPercentage;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BusiestDay {
        private String date;
        private int commits;
    }
}
