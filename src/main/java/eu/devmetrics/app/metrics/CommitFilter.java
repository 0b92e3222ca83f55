package eu.devmetrics.app.metrics;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.git.ContributorCount;
import eu.devmetrics.app.git.GitHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Applies the caller's contributor, bot and merge options to a parsed history.
 */
@Slf4j
@Component
public class CommitFilter {

    private static final Pattern MERGE_SUBJECT = Pattern.compile("^Merge ");

    private final List<String> botPatterns;

    /**
     * @param botPatterns Case-insensitive substrings marking bot names or emails
     */
    public CommitFilter(@Value("${devmetrics.bot-patterns:[bot],-bot,bot@}") List<String> botPatterns) {
        this.botPatterns = botPatterns.stream()
                .map(String::strip)
                .filter(pattern -> !pattern.isEmpty())
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    public GitHistory apply(GitHistory history, AnalysisOptions options) {
        if (!options.hasContributorFilter() && !options.isExcludeBots() && options.isIncludeMergeCommits()) {
            return history;
        }

        List<Commit> commits = filterCommits(history.getCommits(), options);
        List<Commit> commitStats = filterCommits(history.getCommitStats(), options);
        List<ContributorCount> contributors = history.getContributors().stream()
                .filter(contributor -> keepAuthor(contributor.getName(), contributor.getEmail(), options))
                .collect(Collectors.toList());

        Set<String> keptHashes = new HashSet<>();
        commits.forEach(commit -> keptHashes.add(commit.getHash()));
        commitStats.forEach(commit -> keptHashes.add(commit.getHash()));
        Map<String, List<String>> fileChanges = new LinkedHashMap<>();
        history.getFileChanges().forEach((file, hashes) -> {
            List<String> kept = hashes.stream().filter(keptHashes::contains).collect(Collectors.toList());
            if (!kept.isEmpty()) {
                fileChanges.put(file, kept);
            }
        });

        log.debug("Filtered commits from {} to {}", history.getCommits().size(), commits.size());
        return history.toBuilder()
                .commits(commits)
                .commitStats(commitStats)
                .contributors(contributors)
                .fileChanges(fileChanges)
                .build();
    }

    public boolean isBot(String name, String email) {
        String identity = ((name != null ? name : "") + " " + (email != null ? email : "")).toLowerCase(Locale.ROOT);
        return botPatterns.stream().anyMatch(identity::contains);
    }

    private List<Commit> filterCommits(List<Commit> commits, AnalysisOptions options) {
        return commits.stream()
                .filter(commit -> keepAuthor(commit.getAuthorName(), commit.getAuthorEmail(), options))
                .filter(commit -> options.isIncludeMergeCommits() || !MERGE_SUBJECT.matcher(commit.getSubject()).find())
                .collect(Collectors.toList());
    }

    private boolean keepAuthor(String name, String email, AnalysisOptions options) {
        if (options.isExcludeBots() && isBot(name, email)) {
            return false;
        }
        if (!options.hasContributorFilter()) {
            return true;
        }
        return options.getContributors().stream()
                .anyMatch(wanted -> wanted.equalsIgnoreCase(name) || wanted.equalsIgnoreCase(email));
    }
}
