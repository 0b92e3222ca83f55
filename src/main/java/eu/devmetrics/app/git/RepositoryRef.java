package eu.devmetrics.app.git;

import eu.devmetrics.app.validation.MetricValidationException;
import eu.devmetrics.app.validation.MetricValidationException.ValidationErrorCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A repository under analysis: a display name and the working tree location.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RepositoryRef {

    String name;
    Path path;

    public static RepositoryRef of(String name, Path path) {
        if (name == null || name.isBlank()) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_REPOSITORY,
                    "Repository name cannot be empty");
        }
        if (path == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_REPOSITORY,
                    "Repository path cannot be null");
        }
        return new RepositoryRef(name, path);
    }

    /**
     * Creates a reference named after the directory.
     */
    public static RepositoryRef forPath(Path path) {
        if (path == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_REPOSITORY,
                    "Repository path cannot be null");
        }
        Path fileName = path.toAbsolutePath().normalize().getFileName();
        return of(fileName != null ? fileName.toString() : path.toString(), path);
    }

    /**
     * Checks that the path is a git working tree.
     *
     * @throws MetricValidationException with {@code INVALID_REPOSITORY} otherwise
     */
    public void validateGitRepository() {
        if (!Files.isDirectory(path)) {
            throw new MetricValidationException(ValidationErrorCode.INVALID_REPOSITORY,
                    "Repository path does not exist: " + path);
        }
        if (!Files.exists(path.resolve(".git"))) {
            throw new MetricValidationException(ValidationErrorCode.INVALID_REPOSITORY,
                    "Not a git repository: " + path);
        }
    }
}
