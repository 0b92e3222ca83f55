package eu.devmetrics.app.git;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Parses the date renderings git produces, keeping the author's UTC offset.
 * Accepted: git default ({@code Thu Oct 2 14:03:00 2025 +0200}), ISO-like
 * ({@code 2025-10-02 14:03:00 +0200}), strict ISO-8601, RFC-1123 and a bare
 * {@code yyyy-MM-dd}, which is read as midnight UTC.
 */
public class GitDateParser {

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z"),
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy Z", Locale.ENGLISH),
            DateTimeFormatter.RFC_1123_DATE_TIME
    );

    private GitDateParser() {
    }

    /**
     * Parses a git date.
     *
     * @param text The date as printed by git
     * @return The parsed timestamp with its original offset
     * @throws DateTimeParseException if no supported format matches
     */
    public static OffsetDateTime parse(String text) {
        if (text == null || text.isBlank()) {
            throw new DateTimeParseException("Empty date", String.valueOf(text), 0);
        }
        String trimmed = text.trim();
        for (DateTimeFormatter format : OFFSET_FORMATS) {
            try {
                return OffsetDateTime.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                // try the next rendering
            }
        }
        try {
            return LocalDate.parse(trimmed).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new DateTimeParseException("Unrecognized git date: " + trimmed, trimmed, 0, e);
        }
    }
}
