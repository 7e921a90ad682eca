package io.coldtag.core.normalize;

import io.coldtag.core.tag.Tag;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalQuery;
import java.util.Date;
import java.util.regex.Pattern;

/// Parses heterogeneous date representations found in tag values.
///
/// ### Accepted values
/// - a number: epoch milliseconds, converted to local time in the supplied zone
/// - `YYYY-MM-DD`: local midnight, flagged date-only
/// - `YYYY-MM-DD HH:mm[:ss[.SSS]]` or the same with a `T` separator: local time
/// - ISO strings with an offset (`...Z`, `...+08:00`): converted to local time in the zone
/// - `YYYY/M/D H:mm[:ss]`: local time
/// - `LocalDateTime`, `LocalDate` (date-only), `Instant` and `java.util.Date` instances
///
/// Anything else, including blank text, parses to {@link TagDate#absent()}. Parsing never throws.
public final class TagDates {

    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private static final DateTimeFormatter SLASHED =
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyy/M/d H:mm")
                    .optionalStart()
                    .appendPattern(":ss")
                    .optionalEnd()
                    .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
                    .toFormatter();

    private TagDates() {}

    /// Parses the value of a tag.
    ///
    /// @param tag the tag, may be null
    /// @param zone zone used for epoch and offset values, not null
    /// @return parsed date, {@link TagDate#absent()} when the tag is null or its value unusable
    public static TagDate parseTagDate(Tag tag, ZoneId zone) {
        if (tag == null) {
            return TagDate.absent();
        }
        return parse(tag.getValue(), zone);
    }

    /// Parses a raw date value.
    ///
    /// @param raw the value, may be null
    /// @param zone zone used for epoch and offset values, not null
    /// @return parsed date, never null
    public static TagDate parse(Object raw, ZoneId zone) {
        if (raw == null) {
            return TagDate.absent();
        }
        if (raw instanceof LocalDateTime) {
            return new TagDate((LocalDateTime) raw, false);
        }
        if (raw instanceof LocalDate) {
            return new TagDate(((LocalDate) raw).atStartOfDay(), true);
        }
        if (raw instanceof Instant) {
            return new TagDate(LocalDateTime.ofInstant((Instant) raw, zone), false);
        }
        if (raw instanceof Date) {
            return new TagDate(LocalDateTime.ofInstant(((Date) raw).toInstant(), zone), false);
        }
        if (raw instanceof Number) {
            return fromEpochMillis((Number) raw, zone);
        }

        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return TagDate.absent();
        }
        if (DATE_ONLY.matcher(text).matches()) {
            try {
                return new TagDate(LocalDate.parse(text).atStartOfDay(), true);
            } catch (DateTimeParseException e) {
                return TagDate.absent();
            }
        }

        String normalized = text.indexOf('T') >= 0 ? text : text.replaceFirst(" ", "T");
        LocalDateTime parsed = parseDateTime(normalized, zone);
        if (parsed == null) {
            parsed = parseSlashed(text);
        }
        return parsed != null ? new TagDate(parsed, false) : TagDate.absent();
    }

    private static TagDate fromEpochMillis(Number millis, ZoneId zone) {
        double value = millis.doubleValue();
        if (!Double.isFinite(value)) {
            return TagDate.absent();
        }
        try {
            Instant instant = Instant.ofEpochMilli(millis.longValue());
            return new TagDate(LocalDateTime.ofInstant(instant, zone), false);
        } catch (DateTimeException | ArithmeticException e) {
            return TagDate.absent();
        }
    }

    private static LocalDateTime parseDateTime(String text, ZoneId zone) {
        LocalDateTime local =
                tryParse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME, LocalDateTime::from);
        if (local != null) {
            return local;
        }
        OffsetDateTime offset =
                tryParse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME, OffsetDateTime::from);
        return offset != null ? LocalDateTime.ofInstant(offset.toInstant(), zone) : null;
    }

    private static LocalDateTime parseSlashed(String text) {
        return tryParse(text, SLASHED, LocalDateTime::from);
    }

    private static <T> T tryParse(
            String text, DateTimeFormatter formatter, TemporalQuery<T> query) {
        try {
            return formatter.parse(text, query);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
