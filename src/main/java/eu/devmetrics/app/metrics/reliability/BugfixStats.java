package eu.devmetrics.app.metrics.reliability;

import eu.devmetrics.app.git.Commit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Bugfix, feature and maintenance shares of the commit history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BugfixStats {
    private int totalCommits;
    private int bugfixCommits;
    private int featureCommits;
    private int maintenanceCommits;
    private double bugfixRatio;
    private double featureRatio;
    private double maintenanceRatio;
    /** feature / (bugfix + feature), 1.0 when there are neither. */
    private double qualityScore;
    /** Author to statistics, highest bugfix ratio first. */
    private Map<String, AuthorBugfixStats> byAuthor;
    /** Up to ten examples per type, other excluded. */
    private Map<CommitType, List<Commit>> examples;
    /** Null without bugfix commits. */
    private TimePatterns timePatterns;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthorBugfixStats {
        private int totalCommits;
        private int bugfixCommits;
        private int featureCommits;
        private int maintenanceCommits;
        private double bugfixRatio;
        private double featureRatio;
        private double qualityScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimePatterns {
        private Map<Integer, Integer> byHourOfDay;
        private Map<String, Integer> byDayOfWeek;
        /** Chronological. */
        private Map<String, Integer> byMonth;
        private Integer peakBugfixHour;
        private String peakBugfixDay;
        private Map<String, Integer> urgencyKeywords;
        private Map<String, Integer> severityKeywords;
        private int urgentFixes;
        private double urgentRatio;
    }
}
