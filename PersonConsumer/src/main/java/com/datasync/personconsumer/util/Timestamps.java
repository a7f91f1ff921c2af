package com.datasync.personconsumer.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Timestamp parsing for message fields. Values without a zone are read as UTC.
 */
public final class Timestamps {

    public static final String JAVA_DATETIME = "yyyy-MM-dd HH:mm:ss[.SSS]";

    private static final DateTimeFormatter JAVA_DATETIME_FORMATTER = DateTimeFormatter.ofPattern(JAVA_DATETIME);

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDateTime.parse(s, JAVA_DATETIME_FORMATTER).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant(),
            s -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()
    );

    private Timestamps() {
    }

    /**
     * Parses an ISO-8601 instant, offset or local date-time, a
     * "yyyy-MM-dd HH:mm:ss" date-time, a plain date or an RFC 1123 date.
     *
     * @throws IllegalArgumentException if no format matches
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Empty timestamp");
        }
        String trimmed = value.trim();
        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(trimmed);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        throw new IllegalArgumentException("Unrecognized timestamp: " + value, lastError);
    }

    public static Instant fromEpochMillis(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis);
    }
}
