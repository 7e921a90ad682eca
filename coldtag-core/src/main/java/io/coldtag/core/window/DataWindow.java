package io.coldtag.core.window;

import io.coldtag.core.reading.Measure;
import io.coldtag.core.reading.Reading;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Readings fetched for one evaluation, with the interval and devices they were fetched for.
///
/// Readings are held in {@link Reading#CHRONOLOGICAL} order. {@link #queryInfo()} is the
/// diagnostic block every window-based metric starts its detail log with.
///
/// @implNote Immutable.
public final class DataWindow {

    private final Interval interval;
    private final Set<String> locations;
    private final List<Reading> readings;
    private final String queryInfo;

    /// Creates a window.
    ///
    /// @param interval the resolved interval, not null
    /// @param locations queried devices in first-appearance order, not null
    /// @param readings readings in chronological order, not null
    /// @param queryInfo rendered query block, not null
    public DataWindow(
            Interval interval, Set<String> locations, List<Reading> readings, String queryInfo) {
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.locations =
                Collections.unmodifiableSet(
                        new LinkedHashSet<>(
                                Objects.requireNonNull(locations, "locations must not be null")));
        this.readings = List.copyOf(Objects.requireNonNull(readings, "readings must not be null"));
        this.queryInfo = Objects.requireNonNull(queryInfo, "queryInfo must not be null");
    }

    public Interval interval() {
        return interval;
    }

    public Set<String> locations() {
        return locations;
    }

    /// Returns every fetched reading.
    ///
    /// @return unmodifiable chronological list, never null
    public List<Reading> readings() {
        return readings;
    }

    public String queryInfo() {
        return queryInfo;
    }

    /// Returns the readings of the queried devices.
    ///
    /// When no device filter applies every reading matches.
    ///
    /// @return chronological list, never null
    public List<Reading> matched() {
        if (locations.isEmpty()) {
            return readings;
        }
        List<Reading> matched = new ArrayList<>();
        for (Reading reading : readings) {
            if (locations.contains(reading.deviceId())) {
                matched.add(reading);
            }
        }
        return matched;
    }

    /// Returns the matched readings whose measure is finite.
    ///
    /// @param measure the measure to check, not null
    /// @return chronological list, never null
    public List<Reading> finite(Measure measure) {
        List<Reading> finite = new ArrayList<>();
        for (Reading reading : matched()) {
            if (Double.isFinite(measure.of(reading))) {
                finite.add(reading);
            }
        }
        return finite;
    }
}
