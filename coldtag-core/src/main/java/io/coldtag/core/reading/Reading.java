package io.coldtag.core.reading;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;

/// One sensor sample.
///
/// Timestamps are naive local civil time, the same interpretation the report editor uses
/// when rendering dates; no offset is ever applied.
///
/// @param deviceId the location identifier, not null
/// @param timestamp the sample time, not null
/// @param temperature temperature in °C, may be NaN when the sample lacks it
/// @param humidity relative humidity in %, may be NaN when the sample lacks it
public record Reading(String deviceId, LocalDateTime timestamp, double temperature, double humidity) {

    /// Canonical order used before any algorithm runs: timestamp, then device id.
    public static final Comparator<Reading> CHRONOLOGICAL =
            Comparator.comparing(Reading::timestamp).thenComparing(Reading::deviceId);

    public Reading {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
