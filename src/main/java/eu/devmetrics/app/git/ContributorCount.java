package eu.devmetrics.app.git;

import lombok.Builder;
import lombok.Value;

/**
 * One shortlog line: a contributor identity and its commit count.
 */
@Value
@Builder
public class ContributorCount {
    String name;
    String email;
    int commitCount;

    /**
     * Grouping key: the name, or "name &lt;email&gt;" when an email is known.
     */
    public String getIdentity() {
        return email != null ? name + " <" + email + ">" : name;
    }
}
