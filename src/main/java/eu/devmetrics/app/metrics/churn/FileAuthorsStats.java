package eu.devmetrics.app.metrics.churn;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Distinct authors of one file and the resulting bus factor classification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileAuthorsStats {
    private int authorCount;
    /** Sorted alphabetically. */
    private List<String> authors;
    private BusFactorRisk busFactorRisk;
    private AuthorshipType ownershipType;

    public enum BusFactorRisk {
        HIGH,
        MEDIUM,
        LOW;

        public static BusFactorRisk forAuthorCount(int authors) {
            if (authors <= 1) {
                return HIGH;
            }
            return authors <= 3 ? MEDIUM : LOW;
        }
    }

    public enum AuthorshipType {
        SINGLE_OWNER,
        SHARED,
        COLLABORATIVE,
        HIGHLY_COLLABORATIVE;

        public static AuthorshipType forAuthorCount(int authors) {
            if (authors <= 1) {
                return SINGLE_OWNER;
            }
            if (authors <= 3) {
                return SHARED;
            }
            return authors <= 10 ? COLLABORATIVE : HIGHLY_COLLABORATIVE;
        }
    }
}
