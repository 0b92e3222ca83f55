package eu.devmetrics.app.metrics.churn;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileChurnStats {
    private String filename;
    private int totalChurn;
    private int additions;
    private int deletions;
    private int netChanges;
    private int commits;
    private int authorsCount;
    private List<String> authors;
    private double avgChurnPerCommit;
    /** Deleted share of the churn, in percent. */
    private double churnRatio;
}
