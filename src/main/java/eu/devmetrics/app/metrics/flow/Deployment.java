package eu.devmetrics.app.metrics.flow;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * A release event: a production tag or a merge into a main-like branch.
 */
@Value
@Builder
public class Deployment {
    DeploymentType type;
    /** Tag name, or the first eight characters of the merge commit hash. */
    String identifier;
    OffsetDateTime timestamp;
    String commitHash;
    /** {@code tag} or {@code merge}. */
    String method;
    String message;

    public Instant getInstant() {
        return timestamp.toInstant();
    }

    public enum DeploymentType {
        PRODUCTION_RELEASE,
        MERGE_DEPLOYMENT
    }
}
