package eu.devmetrics.app.metrics.reliability;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Purpose of a commit, guessed from its subject line.
 */
public enum CommitType {
    BUGFIX(
            "^fix\\b",
            "^bugfix",
            "\\bfix\\s+(bug|issue|error|problem)",
            "\\b(bug|error|issue)\\s+fix",
            "\\bresol(ve|ution)\\b",
            "\\bhotfix",
            "\\bpatch",
            "\\bcorrect",
            "\\brepair",
            "\\bhandle\\s+(error|exception)"),
    FEATURE(
            "^feat\\b",
            "^feature",
            "^add\\b",
            "^implement",
            "^create",
            "^new\\s+",
            "\\benhance",
            "\\bimprove",
            "\\bupgrade",
            "\\bextend"),
    MAINTENANCE(
            "^refactor",
            "^clean",
            "^update",
            "^chore",
            "^style",
            "^format",
            "^lint",
            "^test",
            "^spec",
            "\\bdocument",
            "\\bcomment",
            "\\btypo",
            "\\bwhitespace",
            "\\breorg",
            "\\bmove\\s",
            "\\brename"),
    OTHER;

    private final List<Pattern> patterns;

    CommitType(String... regexes) {
        this.patterns = Arrays.stream(regexes).map(Pattern::compile).collect(Collectors.toList());
    }

    /**
     * First type, in declaration order, with a pattern matching the lower-cased subject.
     */
    public static CommitType classify(String subject) {
        if (subject == null) {
            return OTHER;
        }
        String message = subject.toLowerCase(Locale.ROOT).strip();
        for (CommitType type : values()) {
            if (type.patterns.stream().anyMatch(pattern -> pattern.matcher(message).find())) {
                return type;
            }
        }
        return OTHER;
    }
}
