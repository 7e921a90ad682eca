package io.coldtag.core.window;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/// A span of naive local time.
///
/// @param start first instant, not null
/// @param end last instant, not null and not before `start`
public record Interval(LocalDateTime start, LocalDateTime end) {

    public Interval {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    /// Returns the one-minute window `[minute, minute + 1min)` containing a time.
    ///
    /// @param time any time, not null
    /// @return interval from the start of the minute to the start of the next minute
    public static Interval minuteOf(LocalDateTime time) {
        LocalDateTime minute = time.truncatedTo(ChronoUnit.MINUTES);
        return new Interval(minute, minute.plusMinutes(1));
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /// Returns the length in whole minutes, rounded down.
    public long wholeMinutes() {
        return duration().toMinutes();
    }

    /// Returns the length in fractional hours.
    public double hours() {
        return duration().toMillis() / 3_600_000.0;
    }

    /// Checks whether a time lies in `[start, end]`.
    public boolean contains(LocalDateTime time) {
        return !time.isBefore(start) && !time.isAfter(end);
    }

    /// Checks whether a time lies in `[start, end)`.
    public boolean containsHalfOpen(LocalDateTime time) {
        return !time.isBefore(start) && time.isBefore(end);
    }
}
