package eu.devmetrics.app.git;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Service running git commands inside a repository working tree.
 */
@Slf4j
@Service
public class GitCommandExecutor {

    private final String gitExecutable;
    private final long timeoutSeconds;

    /**
     * @param gitExecutable  The git binary to invoke (default: git)
     * @param timeoutSeconds Maximum time a single command may run (default: 60)
     */
    public GitCommandExecutor(
            @Value("${devmetrics.git.executable:git}") String gitExecutable,
            @Value("${devmetrics.git.timeout-seconds:60}") long timeoutSeconds) {
        this.gitExecutable = gitExecutable;
        this.timeoutSeconds = timeoutSeconds;
        log.info("GitCommandExecutor initialized with executable '{}', {} second timeout",
                gitExecutable, timeoutSeconds);
    }

    /**
     * Runs {@code git <arguments>} in the given directory and returns its standard output.
     *
     * @throws GitCommandException on a non-zero exit, a timeout or an I/O failure
     */
    public String execute(Path workingDirectory, List<String> arguments) throws GitCommandException {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(arguments);
        log.debug("Running {} in {}", command, workingDirectory);

        Path errorFile = null;
        try {
            errorFile = Files.createTempFile("devmetrics-git", ".err");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDirectory.toFile());
            pb.redirectError(errorFile.toFile());

            Process process = pb.start();
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process));

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("git {} timed out after {} seconds", arguments, timeoutSeconds);
                throw new GitCommandException("git command timed out after " + timeoutSeconds + " seconds", -1);
            }

            String output = stdout.get();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String error = Files.readString(errorFile, StandardCharsets.UTF_8).strip();
                throw new GitCommandException("git " + String.join(" ", arguments)
                        + " failed with exit code " + exitCode + ": " + error, exitCode);
            }
            return output;

        } catch (IOException | ExecutionException e) {
            throw new GitCommandException("Unable to run git " + String.join(" ", arguments), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted while running git", e);
        } finally {
            deleteQuietly(errorFile);
        }
    }

    private static String readAll(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}", file, e);
        }
    }
}
