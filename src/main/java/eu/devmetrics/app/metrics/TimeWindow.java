package eu.devmetrics.app.metrics;

import eu.devmetrics.app.git.Commit;
import eu.devmetrics.app.validation.MetricValidationException;
import eu.devmetrics.app.validation.MetricValidationException.ValidationErrorCode;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Comparator;

/**
 * Immutable start/end pair bounding a history query.
 * The start must be strictly before the end.
 */
@Value
public class TimeWindow {

    private static final DateTimeFormatter DAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    Instant start;
    Instant end;

    private TimeWindow(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Creates a window, failing when a bound is absent or the bounds are not strictly ordered.
     *
     * @param start inclusive start
     * @param end   inclusive end
     * @return the validated window
     */
    public static TimeWindow of(Instant start, Instant end) {
        if (start == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_TIME_WINDOW,
                    "Start date cannot be null");
        }
        if (end == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_TIME_WINDOW,
                    "End date cannot be null");
        }
        if (!start.isBefore(end)) {
            throw new MetricValidationException(ValidationErrorCode.INVALID_TIME_WINDOW,
                    "Start date must be before end date");
        }
        return new TimeWindow(start, end);
    }

    /**
     * Window covering the given number of days up to {@code end}.
     */
    public static TimeWindow lastDays(int days, Instant end) {
        if (end == null) {
            throw new MetricValidationException(ValidationErrorCode.MISSING_TIME_WINDOW,
                    "End date cannot be null");
        }
        return of(end.minus(Duration.ofDays(days)), end);
    }

    /**
     * "All time" window: from the earliest commit up to {@code end}.
     * Falls back to a one-day window ending at {@code end} when there are no commits.
     */
    public static TimeWindow allTime(Collection<Commit> commits, Instant end) {
        Instant first = commits.stream()
                .map(Commit::getInstant)
                .min(Comparator.naturalOrder())
                .orElse(end.minus(Duration.ofDays(1)));
        if (!first.isBefore(end)) {
            first = end.minusSeconds(1);
        }
        return of(first, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public long getDurationDays() {
        return Math.round(Duration.between(start, end).getSeconds() / 86_400.0);
    }

    /**
     * Value for git's {@code --since} option.
     */
    public String getGitSince() {
        return start.toString();
    }

    /**
     * Value for git's {@code --until} option.
     */
    public String getGitUntil() {
        return end.toString();
    }

    @Override
    public String toString() {
        return DAY_FORMAT.format(start) + " to " + DAY_FORMAT.format(end);
    }
}
