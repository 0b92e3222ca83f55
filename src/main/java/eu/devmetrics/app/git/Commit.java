package eu.devmetrics.app.git;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Represents a single git commit, optionally with its per-file line changes.
 * The timestamp keeps the author's UTC offset so that calendar buckets match
 * the author's local day and hour.
 */
@Value
@Builder
public class Commit {
    String hash;
    String authorName;
    String authorEmail;
    OffsetDateTime timestamp;
    String subject;
    @Singular
    List<FileChange> fileChanges;
    int additions;
    int deletions;

    public Instant getInstant() {
        return timestamp.toInstant();
    }

    public int getTotalChanges() {
        return additions + deletions;
    }

    public String getShortHash() {
        return hash.length() > 8 ? hash.substring(0, 8) : hash;
    }

    public boolean hasEmail() {
        return authorEmail != null && !authorEmail.isBlank();
    }
}
