package eu.devmetrics.app.metrics.churn;

import eu.devmetrics.app.util.Statistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two files changed in the same commits, with their Jaccard coupling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoChangePair {
    private String file1;
    private String file2;
    private int coChanges;
    private int file1TotalChanges;
    private int file2TotalChanges;
    private double couplingStrength;
    /** Co-changes relative to the less frequently changed file, in percent. */
    private double couplingPercentage;
    private CouplingCategory couplingCategory;

    public static String key(String file1, String file2) {
        return file1.compareTo(file2) <= 0 ? file1 + " <-> " + file2 : file2 + " <-> " + file1;
    }

    /**
     * Jaccard similarity {@code co / (t1 + t2 - co)} rounded to 3 places; 0 when a total or the union is 0.
     */
    public static double couplingStrength(int coChanges, int file1Total, int file2Total) {
        if (file1Total == 0 || file2Total == 0) {
            return 0.0;
        }
        int union = file1Total + file2Total - coChanges;
        if (union == 0) {
            return 0.0;
        }
        return Statistics.round((double) coChanges / union, 3);
    }

    public enum CouplingCategory {
        HIGH,
        MEDIUM,
        LOW,
        MINIMAL;

        public static CouplingCategory of(double strength) {
            if (strength > 0.5) {
                return HIGH;
            }
            if (strength >= 0.2) {
                return MEDIUM;
            }
            if (strength >= 0.1) {
                return LOW;
            }
            return MINIMAL;
        }
    }
}
