package eu.devmetrics.app.metrics.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Distribution of commit sizes in changed lines.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitSizeStats {
    private int totalCommits;
    private double averageSize;
    private double medianSize;
    private int minSize;
    private int maxSize;
    private int smallCommits;
    private int mediumCommits;
    private int largeCommits;
    private int hugeCommits;
    private double smallPercent;
    private double mediumPercent;
    private double largePercent;
    private double hugePercent;
}
