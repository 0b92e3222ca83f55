package eu.devmetrics.app.metrics.flow;

import eu.devmetrics.app.git.Tag;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Lead time from commit to production release.
 * {@code distribution}, {@code bottlenecks} and {@code trends} are null when there is not enough data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadTimeStats {
    private Overall overall;
    /** Author to statistics, fastest average first. */
    private Map<String, AuthorLeadTime> byAuthor;
    /** The ten most recent production releases, newest first. */
    private List<Tag> productionReleases;
    private Distribution distribution;
    private Bottlenecks bottlenecks;
    private Trends trends;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Overall {
        private int totalCommits;
        private int commitsWithLeadTime;
        private double avgLeadTimeHours;
        private double medianLeadTimeHours;
        private double p95LeadTimeHours;
        private double minLeadTimeHours;
        private double maxLeadTimeHours;
        /** Share of lead times within one week. */
        private double flowEfficiency;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthorLeadTime {
        private int totalCommits;
        private int commitsDeployed;
        private double avgLeadTimeHours;
        private double medianLeadTimeHours;
        private double minLeadTimeHours;
        private double maxLeadTimeHours;
        private double deploymentRate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Distribution {
        private double q1;
        private double q2;
        private double q3;
        private double p50;
        private double p75;
        private double p90;
        private double p95;
        private double p99;
        /** very_fast, fast, moderate, slow, very_slow. */
        private Map<String, Integer> categories;
        private List<Double> outliers;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bottlenecks {
        private double p95ThresholdHours;
        private List<CommitLeadTime> highLeadTimeCommits;
        private Map<String, Integer> commonFactors;
        private Map<String, Integer> bottleneckAuthors;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Trends {
        /** {@code yyyy-MM} to average lead time, chronological. */
        private Map<String, Double> monthlyAverages;
        /** improving, deteriorating or stable. */
        private String trendDirection;
        private double improvementRate;
    }
}
