package com.ssau.pipeline.utils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.exception.MalformedTimestampException;

/**
 * Parses frame timestamps into naive local date-times.
 *
 * <p>Formats are tried in order and the first one that matches wins. Any offset or
 * zone present in the input is dropped without conversion: all timestamps are
 * assumed to already be local wall-clock time.
 */
@Slf4j
public final class TimestampParser {

    public static final String TIMESTREAM_PATTERN = "uuuu_MM_dd_HH_mm_ss";

    /** Date with optional time, {@code T} or space separator, optional offset. */
    public static final DateTimeFormatter ISO_EXTENDED = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .optionalStart()
                .appendLiteral(':')
                .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                .optionalStart()
                    .appendLiteral(':')
                    .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                    .optionalStart()
                        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .optionalEnd()
                .optionalEnd()
            .optionalEnd()
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
        .optionalEnd()
        .toFormatter()
        .withChronology(IsoChronology.INSTANCE)
        .withResolverStyle(ResolverStyle.STRICT);

    public static final DateTimeFormatter TIMESTREAM = DateTimeFormatter.ofPattern(TIMESTREAM_PATTERN)
        .withResolverStyle(ResolverStyle.STRICT);

    private static final List<DateTimeFormatter> FORMATS = List.of(ISO_EXTENDED, TIMESTREAM);

    private TimestampParser() {}

    public static LocalDateTime parse(String text) {
        Objects.requireNonNull(text, "timestamp must not be null");
        for (DateTimeFormatter format : FORMATS) {
            try {
                return toLocalDateTime(format.parse(text));
            } catch (DateTimeParseException e) {
                log.trace("'{}' did not match {}: {}", text, format, e.getMessage());
            }
        }
        throw new MalformedTimestampException(text);
    }

    public static LocalDateTime parse(LocalDateTime dateTime) {
        return Objects.requireNonNull(dateTime, "timestamp must not be null");
    }

    public static LocalDateTime parse(OffsetDateTime dateTime) {
        return dateTime.toLocalDateTime();
    }

    public static LocalDateTime parse(ZonedDateTime dateTime) {
        return dateTime.toLocalDateTime();
    }

    private static LocalDateTime toLocalDateTime(TemporalAccessor parsed) {
        LocalDate date = parsed.query(TemporalQueries.localDate());
        LocalTime time = parsed.query(TemporalQueries.localTime());
        return LocalDateTime.of(date, time == null ? LocalTime.MIDNIGHT : time);
    }
}
