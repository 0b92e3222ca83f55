package eu.devmetrics.app.git;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

class GitDateParserTest {

    @Test
    void testParse_strictIso() {
        OffsetDateTime parsed = GitDateParser.parse("2025-10-02T14:03:00+02:00");

        assertEquals(ZoneOffset.ofHours(2), parsed.getOffset());
        assertEquals(14, parsed.getHour());
    }

    @Test
    void testParse_isoLikeWithSpaces() {
        OffsetDateTime parsed = GitDateParser.parse("2025-10-02 14:03:00 -0500");

        assertEquals(ZoneOffset.ofHours(-5), parsed.getOffset());
        assertEquals(OffsetDateTime.parse("2025-10-02T14:03:00-05:00"), parsed);
    }

    @Test
    void testParse_gitDefaultFormat() {
        OffsetDateTime parsed = GitDateParser.parse("Thu Oct 2 14:03:00 2025 +0200");

        assertEquals(OffsetDateTime.parse("2025-10-02T14:03:00+02:00"), parsed);
    }

    @Test
    void testParse_bareDateIsMidnightUtc() {
        assertEquals(OffsetDateTime.parse("2025-10-02T00:00:00Z"), GitDateParser.parse("2025-10-02"));
    }

    @Test
    void testParse_trimsWhitespace() {
        assertEquals(OffsetDateTime.parse("2025-10-02T14:03:00Z"), GitDateParser.parse("  2025-10-02T14:03:00Z \n"));
    }

    @Test
    void testParse_rejectsGarbage() {
        assertThrows(DateTimeParseException.class, () -> GitDateParser.parse("last tuesday"));
        assertThrows(DateTimeParseException.class, () -> GitDateParser.parse(""));
        assertThrows(DateTimeParseException.class, () -> GitDateParser.parse(null));
    }
}
