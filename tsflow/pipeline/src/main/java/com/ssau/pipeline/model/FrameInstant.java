package com.ssau.pipeline.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.exception.NoTimestampInPathException;
import com.ssau.pipeline.utils.TimestampParser;

/**
 * A generalised moment in time: a naive local date-time, a sub-second counter and
 * an optional index within that moment (a camera or sub-frame id).
 *
 * <p>The canonical form {@code YYYY_MM_DD_HH_MM_SS_SS[_INDEX]} is the key under
 * which results are aggregated, so instants that render identically are the same
 * record. The date-time is kept to whole seconds, so ordering is consistent with
 * {@code equals}.
 */
@Slf4j
@Value
public class FrameInstant implements Comparable<FrameInstant>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("uuuu_MM_dd_HH_mm_ss");
    private static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    private static final Pattern PATH_TIMESTAMP =
        Pattern.compile("(\\d{4}_\\d{2}_\\d{2}_\\d{2}_\\d{2}_\\d{2})(_\\d+)?(_\\w+)?",
            Pattern.UNICODE_CHARACTER_CLASS);

    LocalDateTime dateTime;
    int subsecond;
    String index;

    public FrameInstant(LocalDateTime dateTime, int subsecond, String index) {
        if (subsecond < 0) {
            throw new IllegalArgumentException("subsecond must be non-negative, got " + subsecond);
        }
        // the canonical form has second precision, so equality does too
        this.dateTime = Objects.requireNonNull(dateTime, "dateTime must not be null").truncatedTo(ChronoUnit.SECONDS);
        this.subsecond = subsecond;
        this.index = index;
    }

    public static FrameInstant of(LocalDateTime dateTime) {
        return new FrameInstant(dateTime, 0, null);
    }

    public static FrameInstant of(LocalDateTime dateTime, int subsecond, String index) {
        return new FrameInstant(dateTime, subsecond, index);
    }

    public static FrameInstant of(String timestamp) {
        return new FrameInstant(TimestampParser.parse(timestamp), 0, null);
    }

    public static FrameInstant of(String timestamp, int subsecond, String index) {
        return new FrameInstant(TimestampParser.parse(timestamp), subsecond, index);
    }

    /**
     * Extracts the instant from a timestream file name, with or without directories.
     * The timestamp may appear anywhere in the base name; the sub-second and index
     * suffixes are each optional.
     */
    public static FrameInstant fromPath(String path) {
        Matcher m = PATH_TIMESTAMP.matcher(baseNameWithoutExtension(path));
        if (!m.find()) {
            throw new NoTimestampInPathException(path);
        }

        LocalDateTime dateTime = TimestampParser.parse(m.group(1));

        int subsecond = 0;
        if (m.group(2) != null) {
            try {
                subsecond = Integer.parseInt(m.group(2).substring(1));
            } catch (NumberFormatException e) {
                log.debug("Sub-second '{}' in {} is not an int, using 0", m.group(2), path);
            }
        }

        String index = m.group(3) == null ? null : m.group(3).replaceFirst("^_+", "");
        return new FrameInstant(dateTime, subsecond, index);
    }

    public String toIsoString() {
        return dateTime.format(ISO);
    }

    @Override
    public String toString() {
        String subsec = String.format(Locale.ROOT, "_%02d", subsecond);
        String idx = index == null ? "" : "_" + index;
        return dateTime.format(CANONICAL) + subsec + idx;
    }

    @Override
    public int compareTo(FrameInstant other) {
        return toString().compareTo(other.toString());
    }

    private static String baseNameWithoutExtension(String path) {
        String name = path;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name;
    }
}
