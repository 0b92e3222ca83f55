package eu.devmetrics.app.git;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Parsed history of one repository over one time window.
 * Every collection is non-null; a query that could not be answered is empty.
 */
@Value
@Builder(toBuilder = true)
public class GitHistory {
    @Builder.Default
    List<Commit> commits = Collections.emptyList();
    @Builder.Default
    List<Commit> commitStats = Collections.emptyList();
    @Builder.Default
    Map<String, List<String>> fileChanges = Collections.emptyMap();
    @Builder.Default
    List<ContributorCount> contributors = Collections.emptyList();
    @Builder.Default
    List<Tag> tags = Collections.emptyList();
    @Builder.Default
    List<String> branches = Collections.emptyList();

    public static GitHistory empty() {
        return GitHistory.builder().build();
    }
}
