package eu.devmetrics.app.metrics;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pre-resolved analysis parameters supplied by the caller.
 */
@Value
@Builder
public class AnalysisOptions {

    /**
     * Names or emails to keep; empty keeps everyone.
     */
    @Singular
    List<String> contributors;

    boolean excludeBots;

    @Builder.Default
    boolean includeMergeCommits = true;

    @Singular
    Set<String> excludedMetrics;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }

    public boolean hasContributorFilter() {
        return !contributors.isEmpty();
    }

    /**
     * Flat rendering used in result metadata.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("contributors", contributors);
        map.put("exclude_bots", excludeBots);
        map.put("include_merge_commits", includeMergeCommits);
        map.put("excluded_metrics", excludedMetrics);
        return map;
    }
}
