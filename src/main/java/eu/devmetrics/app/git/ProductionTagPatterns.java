package eu.devmetrics.app.git;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Tag name patterns identifying production releases.
 */
public final class ProductionTagPatterns {

    public static final List<Pattern> DEFAULTS = List.of(
            // semantic versioning: v1.2.3, 1.2.3-rc1
            Pattern.compile("^v?\\d+\\.\\d+\\.\\d+$"),
            Pattern.compile("^v?\\d+\\.\\d+\\.\\d+[-_](alpha|beta|rc\\d*)", Pattern.CASE_INSENSITIVE),

            // release branches: release-v1.2
            Pattern.compile("^release[-_]v?\\d+\\.\\d+"),

            // environment markers
            Pattern.compile("^prod[-_]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^production[-_]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[-_]prod$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[-_]release$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^deploy[-_]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[-_]deploy$", Pattern.CASE_INSENSITIVE),

            // date versions: v2025.10.02, v2025.09.01.1
            Pattern.compile("^v\\d{4}\\.\\d{2}\\.\\d{2}(\\.\\d+)?$"),
            Pattern.compile("^v\\d{4}\\.\\d{2}\\.\\d{2}(\\.\\d+)?[-_](alpha|beta|rc\\d*)", Pattern.CASE_INSENSITIVE),

            // compact dates: v20250630, v20241024_1
            Pattern.compile("^v\\d{8}(\\.\\d+)?$"),
            Pattern.compile("^v\\d{8}(\\.\\d+)?[-_](alpha|beta|rc\\d*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^v\\d{8}[-_]\\d+$"),

            // plain numbered versions: v31
            Pattern.compile("^v\\d+$")
    );

    private ProductionTagPatterns() {
    }
}
