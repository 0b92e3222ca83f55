package eu.devmetrics.app.metrics.churn;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Ownership of one file: who changed how many of its lines.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileOwnershipStats {
    private String primaryOwner;
    private double primaryOwnerPercentage;
    private String lastModifiedBy;
    private OffsetDateTime lastModifiedDate;
    private int totalCommits;
    private int totalChanges;
    private int contributorCount;
    /** Author to share of changed lines in percent, largest share first. */
    private Map<String, Double> ownershipDistribution;
    /** Herfindahl-Hirschman index of the shares, 0 to 100. */
    private double ownershipConcentration;
    private OwnershipType ownershipType;

    public enum OwnershipType {
        SINGLE_OWNER,
        DOMINANT_OWNER,
        PRIMARY_OWNER,
        SHARED_OWNERSHIP,
        DISTRIBUTED_OWNERSHIP;

        public static OwnershipType of(int contributors, double maxShare) {
            if (contributors == 1) {
                return SINGLE_OWNER;
            }
            if (maxShare >= 80) {
                return DOMINANT_OWNER;
            }
            if (maxShare >= 60) {
                return PRIMARY_OWNER;
            }
            if (maxShare >= 40) {
                return SHARED_OWNERSHIP;
            }
            return DISTRIBUTED_OWNERSHIP;
        }
    }
}
