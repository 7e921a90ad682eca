package io.coldtag.core.normalize;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/// Timestamp renderings used in results and logs.
public final class TimeFormats {

    /// `YYYY-MM-DD HH:mm`: minute bucket keys and time-valued results.
    public static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    /// `YYYY/MM/DD HH:mm`: human-readable interval bounds in logs.
    public static final DateTimeFormatter HUMAN = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm");

    private TimeFormats() {}

    /// Truncates a timestamp to the start of its minute.
    public static LocalDateTime truncateToMinute(LocalDateTime timestamp) {
        return timestamp.truncatedTo(ChronoUnit.MINUTES);
    }

    /// Returns the minute bucket key of a timestamp, e.g. `2024-01-15 09:00`.
    public static String minuteKey(LocalDateTime timestamp) {
        return MINUTE.format(timestamp);
    }

    public static String human(LocalDateTime timestamp) {
        return HUMAN.format(timestamp);
    }

    /// Renders an interval as `start ~ end` in human form.
    public static String range(LocalDateTime start, LocalDateTime end) {
        return human(start) + " ~ " + human(end);
    }
}
