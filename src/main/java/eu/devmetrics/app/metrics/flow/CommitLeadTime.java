package eu.devmetrics.app.metrics.flow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A commit paired with the first production release that shipped it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitLeadTime {
    private String hash;
    private String author;
    private OffsetDateTime commitDate;
    private String subject;
    private double leadTimeHours;
    private double leadTimeDays;
    private String deployedInRelease;
    private OffsetDateTime deploymentDate;
}
