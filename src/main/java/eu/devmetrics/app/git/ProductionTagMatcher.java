package eu.devmetrics.app.git;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies tag names as production releases against a pattern table.
 */
public class ProductionTagMatcher {

    private final List<Pattern> patterns;

    public ProductionTagMatcher(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static ProductionTagMatcher withDefaults() {
        return new ProductionTagMatcher(ProductionTagPatterns.DEFAULTS);
    }

    public boolean isProductionTag(String tagName) {
        if (tagName == null || tagName.isEmpty()) {
            return false;
        }
        return patterns.stream().anyMatch(pattern -> pattern.matcher(tagName).find());
    }

    public List<Tag> filterProductionTags(Collection<Tag> tags) {
        return tags.stream()
                .filter(tag -> isProductionTag(tag.getName()))
                .collect(Collectors.toList());
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }
}
