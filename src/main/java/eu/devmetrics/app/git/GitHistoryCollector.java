package eu.devmetrics.app.git;

import eu.devmetrics.app.metrics.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service fetching the raw history of a repository and parsing it.
 * A query that fails is logged and treated as absent input.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GitHistoryCollector {

    static final String COMMIT_FORMAT = "--pretty=format:%H|%an|%ae|%aI|%s";
    static final String TAG_FORMAT = "--format=%(refname:short)|%(creatordate:iso-strict)";

    private final GitCommandExecutor executor;
    private final GitLogParser parser;

    /**
     * Collect commits, numstat, touched files, contributors, tags and branches
     * for the given window.
     */
    public GitHistory collect(RepositoryRef repository, TimeWindow window) {
        log.info("Collecting history of {} for {}", repository.getName(), window);

        GitHistory history = GitHistory.builder()
                .commits(parser.parseCommits(run(repository, "commits",
                        windowed(window, "log", "--all", COMMIT_FORMAT))))
                .commitStats(parser.parseCommitStats(run(repository, "commit stats",
                        windowed(window, "log", "--all", "--numstat", COMMIT_FORMAT))))
                .fileChanges(parser.parseFileChanges(run(repository, "file changes",
                        windowed(window, "log", "--all", "--name-only", "--pretty=format:%H"))))
                .contributors(parser.parseContributors(run(repository, "contributors",
                        windowed(window, "shortlog", "--summary", "--numbered", "--email", "--all"))))
                .tags(parser.parseTags(run(repository, "tags",
                        List.of("tag", "-l", "--sort=-creatordate", TAG_FORMAT))))
                .branches(parser.parseBranches(run(repository, "branches",
                        List.of("branch", "--list"))))
                .build();

        log.info("Collected {} commits, {} tags and {} branches from {}",
                history.getCommits().size(), history.getTags().size(),
                history.getBranches().size(), repository.getName());
        return history;
    }

    private String run(RepositoryRef repository, String query, List<String> arguments) {
        try {
            return executor.execute(repository.getPath(), arguments);
        } catch (GitCommandException e) {
            log.warn("Could not fetch {} from {}: {}", query, repository.getName(), e.getMessage());
            return "";
        }
    }

    private static List<String> windowed(TimeWindow window, String... arguments) {
        List<String> command = new ArrayList<>(List.of(arguments));
        command.add("--since=" + window.getGitSince());
        command.add("--until=" + window.getGitUntil());
        return command;
    }
}
