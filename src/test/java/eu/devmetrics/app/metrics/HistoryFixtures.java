package eu.devmetrics.app.metrics;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.git.FileChange;
import eu.devmetrics.app.git.GitHistory;
import eu.devmetrics.app.git.RepositoryRef;
import eu.devmetrics.app.git.Tag;

import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builders for hand-made histories used across metric tests.
 */
public final class HistoryFixtures {

    public static final RepositoryRef REPOSITORY = RepositoryRef.of("sample", Path.of("sample"));
    public static final TimeWindow WINDOW =
            TimeWindow.of(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-12-31T00:00:00Z"));

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private HistoryFixtures() {
    }

    public static String hash() {
        return String.format("%040x", SEQUENCE.incrementAndGet());
    }

    public static Commit commit(String author, String timestamp, String subject) {
        return Commit.builder()
                .hash(hash())
                .authorName(author)
                .authorEmail(author.toLowerCase().replace(' ', '.') + "@example.com")
                .timestamp(OffsetDateTime.parse(timestamp))
                .subject(subject)
                .build();
    }

    /**
     * A commit with numstat data; {@code files} alternate filename, additions, deletions.
     */
    public static Commit statCommit(String author, String timestamp, Object... files) {
        Commit.CommitBuilder builder = Commit.builder()
                .hash(hash())
                .authorName(author)
                .authorEmail(author.toLowerCase().replace(' ', '.') + "@example.com")
                .timestamp(OffsetDateTime.parse(timestamp))
                .subject("Change by " + author);
        int additions = 0;
        int deletions = 0;
        for (int i = 0; i < files.length; i += 3) {
            int added = (Integer) files[i + 1];
            int deleted = (Integer) files[i + 2];
            builder.fileChange(FileChange.builder()
                    .filename((String) files[i])
                    .additions(added)
                    .deletions(deleted)
                    .build());
            additions += added;
            deletions += deleted;
        }
        return builder.additions(additions).deletions(deletions).build();
    }

    public static Tag tag(String name, String timestamp) {
        return Tag.builder()
                .name(name)
                .timestamp(timestamp == null ? null : OffsetDateTime.parse(timestamp))
                .build();
    }

    public static MetricInput input(GitHistory history) {
        return MetricInput.builder()
                .repository(REPOSITORY)
                .window(WINDOW)
                .history(history)
                .build();
    }

    public static MetricInput empty() {
        return input(GitHistory.empty());
    }

    /**
     * Runs the metric and fails the test when it reports a failure.
     */
    public static MetricComputation compute(GitMetric metric, MetricInput input) {
        return metric.calculate(input).fold(
                computation -> computation,
                failure -> {
                    throw new AssertionError(failure.errorClass() + ": " + failure.message());
                });
    }

    @SuppressWarnings("unchecked")
    public static <T> T summary(MetricComputation computation) {
        return ((MetricValue.Summary<T>) computation.getValue()).stats();
    }

    @SuppressWarnings("unchecked")
    public static <R> Map<String, R> keyed(MetricComputation computation) {
        return ((MetricValue.KeyedTable<R>) computation.getValue()).entries();
    }
}
