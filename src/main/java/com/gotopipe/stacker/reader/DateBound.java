package com.gotopipe.stacker.reader;

import com.gotopipe.stacker.store.ObservationSchema;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * A requested window bound, either an absolute timestamp or a duration relative to now.
 *
 * <p>A relative lower bound lies {@code |duration|} in the past; a relative upper bound is {@code now + duration}.</p>
 */
public final class DateBound {
    // configured bounds may use a 'T' separator and any fraction, they are re-encoded before querying
    private static final DateTimeFormatter BOUND_PARSER = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd[ ]['T']HH:mm:ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
        .optionalEnd()
        .toFormatter();

    private final LocalDateTime absolute;
    private final Duration relative;

    private DateBound(LocalDateTime absolute, Duration relative) {
        this.absolute = absolute;
        this.relative = relative;
    }

    public static DateBound absolute(LocalDateTime timestamp) {
        return new DateBound(timestamp, null);
    }

    public static DateBound relative(Duration duration) {
        return new DateBound(null, duration);
    }

    /**
     * Parses {@code 2018-09-09 12:00:00} style timestamps or ISO-8601 durations such as {@code P1D} / {@code -PT12H}.
     *
     * @throws IllegalArgumentException if the text is neither
     */
    public static DateBound parse(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("-P") || trimmed.startsWith("+P")) {
            try {
                return relative(Duration.parse(trimmed));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid duration bound: " + text, e);
            }
        }
        try {
            return absolute(LocalDateTime.parse(trimmed, BOUND_PARSER));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid date bound: " + text, e);
        }
    }

    public boolean isRelative() {
        return relative != null;
    }

    public LocalDateTime resolveLower(Clock clock) {
        if (relative == null) {
            return absolute;
        }
        return LocalDateTime.now(clock).minus(relative.abs());
    }

    public LocalDateTime resolveUpper(Clock clock) {
        if (relative == null) {
            return absolute;
        }
        return LocalDateTime.now(clock).plus(relative);
    }

    @Override
    public String toString() {
        return relative != null ? relative.toString() : ObservationSchema.formatObsdate(absolute);
    }
}
