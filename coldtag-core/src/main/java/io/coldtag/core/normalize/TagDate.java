package io.coldtag.core.normalize;

import java.time.LocalDateTime;

/// Parsed temporal tag value.
///
/// @param dateTime the parsed local date-time, null when the value was empty or unparseable
/// @param dateOnly true when the value was a bare `YYYY-MM-DD` date (local midnight)
public record TagDate(LocalDateTime dateTime, boolean dateOnly) {

    private static final TagDate ABSENT = new TagDate(null, false);

    public static TagDate absent() {
        return ABSENT;
    }

    public boolean isPresent() {
        return dateTime != null;
    }
}
