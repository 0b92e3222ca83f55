package eu.devmetrics.app.git;

import lombok.Builder;
import lombok.Value;

/**
 * Lines added and deleted in one file by one commit.
 * Binary files report zero for both counts.
 */
@Value
@Builder
public class FileChange {
    String filename;
    int additions;
    int deletions;

    public int getTotalChanges() {
        return additions + deletions;
    }
}
