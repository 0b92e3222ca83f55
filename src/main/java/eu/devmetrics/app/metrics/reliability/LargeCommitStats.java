package eu.devmetrics.app.metrics.reliability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Commits that are large relative to the rest of the history.
 * Size is lines changed plus ten per file touched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LargeCommitStats {
    private int totalCommits;
    private int largeCommits;
    private int hugeCommits;
    private double largeCommitRatio;
    private double hugeCommitRatio;
    private double riskScore;
    private double avgCommitSize;
    private Thresholds thresholds;
    /** Author to statistics, highest risk first. */
    private Map<String, AuthorSizeStats> byAuthor;
    /** Large and huge commits, biggest first, at most twenty. */
    private List<SizedCommit> largestCommits;
    private SizeDistribution sizeDistribution;
    /** Risk factor to occurrences among large and huge commits, most common first. */
    private Map<String, Integer> commonRiskFactors;
    private Map<Integer, Integer> largeByHourOfDay;
    private Map<String, Integer> largeByDayOfWeek;

    public enum SizeCategory {
        SMALL,
        MEDIUM,
        LARGE,
        HUGE
    }

    /**
     * 25th, 50th, 75th and 90th percentile of the commit sizes.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        private int small;
        private int medium;
        private int large;
        private int huge;

        public SizeCategory categorize(int size) {
            if (size <= small) {
                return SizeCategory.SMALL;
            }
            if (size <= medium) {
                return SizeCategory.MEDIUM;
            }
            if (size <= large) {
                return SizeCategory.LARGE;
            }
            return SizeCategory.HUGE;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SizedCommit {
        private String hash;
        private String author;
        private OffsetDateTime date;
        private String subject;
        private int size;
        private int filesChanged;
        private SizeCategory category;
        private List<String> riskFactors;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthorSizeStats {
        private int totalCommits;
        private int largeCommits;
        private int hugeCommits;
        private double avgCommitSize;
        private int maxCommitSize;
        private double largeCommitRatio;
        private double riskScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SizeDistribution {
        private int min;
        private int max;
        private double median;
        private double p75;
        private double p90;
        private double p95;
        private double p99;
        private double stdDeviation;
    }
}
