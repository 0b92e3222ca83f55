package eu.devmetrics.app.metrics.activity;

import eu.devmetrics.app.util.Statistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lines added and removed by one author.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorChangeStats {
    private String authorName;
    private String authorEmail;
    private int additions;
    private int deletions;
    private int commits;

    public int getNetChanges() {
        return additions - deletions;
    }

    public int getTotalChanges() {
        return additions + deletions;
    }

    public double getAvgChangesPerCommit() {
        return commits == 0 ? 0.0 : Statistics.round((double) getTotalChanges() / commits, 2);
    }

    /**
     * Deleted share of all changed lines, in percent.
     */
    public double getChurnRatio() {
        return Statistics.round(Statistics.percentage(deletions, getTotalChanges()), 1);
    }

    public String getDisplayName() {
        return authorEmail != null && !authorEmail.isEmpty() ? authorName + " <" + authorEmail + ">" : authorName;
    }
}
