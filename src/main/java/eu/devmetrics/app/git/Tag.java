package eu.devmetrics.app.git;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * A git tag. The timestamp is absent when the tag listing carried no date.
 */
@Value
@Builder
public class Tag {
    String name;
    OffsetDateTime timestamp;
    String commitHash;

    public boolean isDated() {
        return timestamp != null;
    }
}
