package eu.devmetrics.app.git;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Service converting raw git output into typed history records.
 * Blank lines are ignored everywhere. Malformed lines are skipped, but a
 * failure affecting the whole blob (typically an unparseable date) makes the
 * operation return an empty container: partial output is never returned.
 */
@Slf4j
@Service
public class GitLogParser {

    private static final Pattern NUMSTAT_LINE = Pattern.compile("^(\\d+|-)\\s+(\\d+|-)\\s+(.+)$");
    private static final Pattern COMMIT_HASH_LINE = Pattern.compile("^[a-f0-9]{40}$");
    private static final Pattern SHORTLOG_LINE = Pattern.compile("^\\s*(\\d+)\\s+(.+)$");
    private static final Pattern NAME_WITH_EMAIL = Pattern.compile("^(.+)\\s+<(.+)>$");

    private static final int COMMIT_FIELDS = 5;
    private static final String BINARY_MARKER = "-";

    /**
     * Parse {@code hash|author|email|date|subject} lines.
     *
     * @param output Raw git log output
     * @return Parsed commits in source order, or an empty list if any date fails to parse
     */
    public List<Commit> parseCommits(String output) {
        if (output == null || output.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<Commit> commits = new ArrayList<>();
            for (String line : output.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                String[] parts = line.split("\\|", COMMIT_FIELDS);
                if (parts.length < COMMIT_FIELDS) {
                    log.debug("Skipping malformed commit line: {}", line);
                    continue;
                }
                commits.add(headerBuilder(parts).build());
            }
            return commits;
        } catch (Exception e) {
            log.warn("Failed to parse commits: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Parse commit header lines each followed by their {@code --numstat} lines.
     * A numstat line belongs to the most recent header; numstat lines before the
     * first header are ignored. Binary files ({@code -}) count as zero lines.
     */
    public List<Commit> parseCommitStats(String output) {
        if (output == null || output.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<Commit> commits = new ArrayList<>();
            Commit.CommitBuilder current = null;
            int additions = 0;
            int deletions = 0;

            for (String rawLine : output.split("\n")) {
                String line = rawLine.strip();
                if (line.isEmpty()) {
                    continue;
                }
                if (isCommitHeader(line)) {
                    if (current != null) {
                        commits.add(current.additions(additions).deletions(deletions).build());
                    }
                    current = headerBuilder(line.split("\\|", COMMIT_FIELDS));
                    additions = 0;
                    deletions = 0;
                    continue;
                }
                Matcher numstat = NUMSTAT_LINE.matcher(line);
                if (current != null && numstat.matches()) {
                    int added = lineCount(numstat.group(1));
                    int deleted = lineCount(numstat.group(2));
                    current.fileChange(FileChange.builder()
                            .filename(numstat.group(3))
                            .additions(added)
                            .deletions(deleted)
                            .build());
                    additions += added;
                    deletions += deleted;
                }
            }
            if (current != null) {
                commits.add(current.additions(additions).deletions(deletions).build());
            }
            return commits;
        } catch (Exception e) {
            log.warn("Failed to parse commit stats: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Parse alternating 40-character commit hash lines and filename lines.
     *
     * @return filename to the hashes of the commits touching it, in first-seen order
     */
    public Map<String, List<String>> parseFileChanges(String output) {
        if (output == null || output.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, List<String>> fileCommits = new LinkedHashMap<>();
            String currentCommit = null;
            for (String rawLine : output.split("\n")) {
                String line = rawLine.strip();
                if (line.isEmpty()) {
                    continue;
                }
                if (COMMIT_HASH_LINE.matcher(line).matches()) {
                    currentCommit = line;
                } else if (currentCommit != null) {
                    fileCommits.computeIfAbsent(line, k -> new ArrayList<>()).add(currentCommit);
                }
            }
            return fileCommits;
        } catch (Exception e) {
            log.warn("Failed to parse file changes: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    /**
     * Parse {@code git shortlog -sne} output.
     */
    public List<ContributorCount> parseContributors(String output) {
        if (output == null || output.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<ContributorCount> contributors = new ArrayList<>();
            for (String line : output.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                Matcher matcher = SHORTLOG_LINE.matcher(line);
                if (!matcher.matches()) {
                    continue;
                }
                int count = Integer.parseInt(matcher.group(1));
                String info = matcher.group(2);
                Matcher identity = NAME_WITH_EMAIL.matcher(info);
                if (identity.matches()) {
                    contributors.add(ContributorCount.builder()
                            .name(identity.group(1).strip())
                            .email(identity.group(2).strip())
                            .commitCount(count)
                            .build());
                } else {
                    contributors.add(ContributorCount.builder()
                            .name(info.strip())
                            .commitCount(count)
                            .build());
                }
            }
            return contributors;
        } catch (Exception e) {
            log.warn("Failed to parse contributors: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Parse tag lines of the form {@code name|date[|commitHash]} or a bare {@code name}.
     * Tags without a date are kept with no timestamp.
     */
    public List<Tag> parseTags(String output) {
        if (output == null || output.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<Tag> tags = new ArrayList<>();
            for (String rawLine : output.split("\n")) {
                String line = rawLine.strip();
                if (line.isEmpty()) {
                    continue;
                }
                String[] parts = line.split("\\|", 3);
                Tag.TagBuilder tag = Tag.builder().name(parts[0].strip());
                if (parts.length > 1 && !parts[1].isBlank()) {
                    tag.timestamp(GitDateParser.parse(parts[1]));
                }
                if (parts.length > 2 && !parts[2].isBlank()) {
                    tag.commitHash(parts[2].strip());
                }
                tags.add(tag.build());
            }
            return tags;
        } catch (Exception e) {
            log.warn("Failed to parse tags: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Parse {@code git branch} output, dropping the current-branch marker and symbolic refs.
     */
    public List<String> parseBranches(String output) {
        if (output == null || output.isBlank()) {
            return Collections.emptyList();
        }
        List<String> branches = new ArrayList<>();
        for (String rawLine : output.split("\n")) {
            String line = rawLine.strip();
            if (line.startsWith("* ")) {
                line = line.substring(2).strip();
            }
            if (line.isEmpty() || line.contains(" -> ")) {
                continue;
            }
            branches.add(line);
        }
        return branches;
    }

    private static boolean isCommitHeader(String line) {
        return line.chars().filter(c -> c == '|').count() >= 4;
    }

    private static Commit.CommitBuilder headerBuilder(String[] parts) {
        OffsetDateTime timestamp = GitDateParser.parse(parts[3]);
        String email = parts[2].strip();
        return Commit.builder()
                .hash(parts[0].strip())
                .authorName(parts[1].strip())
                .authorEmail(email.isEmpty() ? null : email)
                .timestamp(timestamp)
                .subject(parts[4].strip());
    }

    private static int lineCount(String field) {
        return BINARY_MARKER.equals(field) ? 0 : Integer.parseInt(field);
    }
}
