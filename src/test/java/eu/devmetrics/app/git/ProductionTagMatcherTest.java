package eu.devmetrics.app.git;

import eu.devmetrics.app.metrics.HistoryFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ProductionTagMatcherTest {

    private final ProductionTagMatcher matcher = ProductionTagMatcher.withDefaults();

    @Test
    void testIsProductionTag_recognisedNames() {
        for (String name : List.of("v1.2.3", "1.2.3", "v1.2.3-rc1", "v1.2.3_BETA", "release-v1.2", "release_2.0",
                "prod-2024-01", "PRODUCTION_eu", "eu-prod", "2024-release", "deploy-42", "web_deploy",
                "v2025.10.02", "v2025.09.01.1", "v2025.10.02-rc2", "v20250630", "v20250630.1",
                "v20241024_1", "v31")) {
            assertTrue(matcher.isProductionTag(name), name);
        }
    }

    @Test
    void testIsProductionTag_rejectedNames() {
        for (String name : List.of("experimental", "v1.2", "feature-prod-ish", "nightly", "vnext", "release")) {
            assertFalse(matcher.isProductionTag(name), name);
        }
    }

    @Test
    void testIsProductionTag_nullOrEmpty() {
        assertFalse(matcher.isProductionTag(null));
        assertFalse(matcher.isProductionTag(""));
    }

    @Test
    void testFilterProductionTags_keepsOrder() {
        Tag first = HistoryFixtures.tag("v2.0.0", "2024-02-01T00:00:00Z");
        Tag skipped = HistoryFixtures.tag("wip", "2024-02-02T00:00:00Z");
        Tag second = HistoryFixtures.tag("v1.0.0", null);

        assertEquals(List.of(first, second), matcher.filterProductionTags(List.of(first, skipped, second)));
    }

    @Test
    void testCustomPatterns_replaceDefaults() {
        ProductionTagMatcher custom = new ProductionTagMatcher(List.of(Pattern.compile("^ship-")));

        assertTrue(custom.isProductionTag("ship-7"));
        assertFalse(custom.isProductionTag("v1.2.3"));
        assertEquals(1, custom.getPatterns().size());
    }
}
