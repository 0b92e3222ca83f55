package eu.devmetrics.app.git;

/**
 * Exception thrown when a git process fails, times out or cannot be started.
 */
public class GitCommandException extends Exception {

    private final int exitCode;

    public GitCommandException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /**
     * Process exit code, or -1 when the process did not exit normally.
     */
    public int getExitCode() {
        return exitCode;
    }
}
