package eu.devmetrics.app.metrics.reliability;

import eu.devmetrics.app.git.Commit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Revert activity. Rates are percentages of all commits in the window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevertStats {
    private int totalCommits;
    private int revertCommits;
    private int revertedCommits;
    private double revertRate;
    private double revertedRate;
    /** 1 minus the share of commits that were reverted, floored at 0. */
    private double stabilityScore;
    /** Author to statistics, highest reverted rate first. */
    private Map<String, AuthorRevertStats> byAuthor;
    private List<Commit> recentReverts;
    private List<Commit> recentReverted;
    private Map<String, Integer> revertReasons;
    /** Null when nothing was reverted. */
    private TimePatterns timePatterns;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthorRevertStats {
        private int totalCommits;
        private int revertsMade;
        private int commitsReverted;
        private double revertRate;
        private double revertedRate;
        private double reliabilityScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimePatterns {
        private Map<Integer, Integer> byHourOfDay;
        private Map<String, Integer> byDayOfWeek;
        private Integer peakRevertHour;
        private String peakRevertDay;
    }
}
