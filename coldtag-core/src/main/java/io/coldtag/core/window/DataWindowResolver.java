package io.coldtag.core.window;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.InputRole;
import io.coldtag.core.function.WindowRef;
import io.coldtag.core.normalize.Locations;
import io.coldtag.core.normalize.TagDate;
import io.coldtag.core.normalize.TagDates;
import io.coldtag.core.normalize.TimeFormats;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.reading.ReadingStore;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.tag.TagRoster;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Resolves a function's query window and fetches its readings.
///
/// Resolution runs in two steps so callers can validate their own inputs in between:
/// {@link #prepare(WindowRef, TagRoster)} resolves devices and interval without touching the
/// store, {@link #fetch(String, WindowQuery)} runs the query.
///
/// ### Interval rules
/// - a date-only start is clamped to `00:00:00.000`, a date-only end to `23:59:59.999`
/// - an unparseable or missing endpoint, or a start after the end, is
///   {@link ErrorCode#INVALID_INTERVAL}
///
/// Fetched readings are sorted with a stable {@link Reading#CHRONOLOGICAL} sort, so results
/// never depend on the order the store returns them in.
///
/// @implNote Stateless apart from its collaborators; thread-safe when the store is.
public class DataWindowResolver {

    private static final Logger logger = Logger.getLogger(DataWindowResolver.class.getName());

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    private final ReadingStore store;
    private final ZoneId zone;

    /// Creates a resolver.
    ///
    /// @param store the reading store, not null
    /// @param zone zone used to read epoch values of date tags, not null
    public DataWindowResolver(ReadingStore store, ZoneId zone) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId getZone() {
        return zone;
    }

    /// Resolves devices and interval of a window reference.
    ///
    /// @param ref the window reference, not null
    /// @param roster the tag snapshot, not null
    /// @return the query to run, never null
    /// @throws EvaluationException if no device resolves or the interval is invalid
    public WindowQuery prepare(WindowRef ref, TagRoster roster) throws EvaluationException {
        Set<String> locations =
                resolveLocations(ref.locationTagIds(), roster, InputRole.LOCATIONS);
        Interval interval = resolveInterval(ref.startTagId(), ref.endTagId(), roster);
        return new WindowQuery(interval, locations);
    }

    /// Unions the devices of the referenced location tags.
    ///
    /// @param tagIds location tag ids, may be null
    /// @param roster the tag snapshot, not null
    /// @param role the role reported when no device resolves, not null
    /// @return non-empty ordered set of device ids
    /// @throws EvaluationException with {@link ErrorCode#MISSING_INPUT} when no device resolves
    public Set<String> resolveLocations(List<String> tagIds, TagRoster roster, InputRole role)
            throws EvaluationException {
        Set<String> locations = Locations.distinctLocations(tagIds, roster);
        if (locations.isEmpty()) {
            throw new EvaluationException(ErrorCode.MISSING_INPUT, role.getMissingMessage());
        }
        return locations;
    }

    /// Resolves the interval between two date tags.
    ///
    /// @param startTagId start tag id, may be null
    /// @param endTagId end tag id, may be null
    /// @param roster the tag snapshot, not null
    /// @return the interval, never null
    /// @throws EvaluationException with {@link ErrorCode#INVALID_INTERVAL} if an endpoint is
    ///     unusable or the start is after the end
    public Interval resolveInterval(String startTagId, String endTagId, TagRoster roster)
            throws EvaluationException {
        TagDate start = TagDates.parseTagDate(roster.find(startTagId).orElse(null), zone);
        TagDate end = TagDates.parseTagDate(roster.find(endTagId).orElse(null), zone);
        if (!start.isPresent() || !end.isPresent()) {
            throw new EvaluationException(ErrorCode.INVALID_INTERVAL, "开始或结束时间无效");
        }

        LocalDateTime from = start.dateTime();
        if (start.dateOnly()) {
            from = from.toLocalDate().atStartOfDay();
        }
        LocalDateTime to = end.dateTime();
        if (end.dateOnly()) {
            to = to.toLocalDate().atTime(END_OF_DAY);
        }
        if (from.isAfter(to)) {
            throw new EvaluationException(ErrorCode.INVALID_INTERVAL, "开始时间不能晚于结束时间");
        }
        return new Interval(from, to);
    }

    /// Runs a prepared query.
    ///
    /// @param taskId the task, not null
    /// @param query the prepared query, not null
    /// @return the window with at least one reading, never null
    /// @throws EvaluationException with {@link ErrorCode#NO_DATA} when nothing matches; the
    ///     query block is attached as detail
    /// @throws ReadingStoreException if the store fails
    public DataWindow fetch(String taskId, WindowQuery query)
            throws EvaluationException, ReadingStoreException {
        Interval interval = query.interval();
        Set<String> locations = query.locations();

        List<Reading> readings =
                sorted(store.queryReadings(taskId, interval.start(), interval.end(), locations));
        String queryInfo = queryInfo(locations, interval, readings.size());
        logger.fine(
                "Fetched "
                        + readings.size()
                        + " readings for task "
                        + taskId
                        + " in "
                        + TimeFormats.range(interval.start(), interval.end()));

        if (readings.isEmpty()) {
            throw new EvaluationException(ErrorCode.NO_DATA, "时间范围内没有匹配数据", queryInfo);
        }
        return new DataWindow(interval, locations, readings, queryInfo);
    }

    /// Fetches the readings of a one-minute window.
    ///
    /// The store answers inclusively, so readings at the window's exclusive end are dropped.
    ///
    /// @param taskId the task, not null
    /// @param minute a window from {@link Interval#minuteOf(LocalDateTime)}, not null
    /// @param locations devices to query, not null
    /// @return chronological readings in `[start, end)`, possibly empty
    /// @throws ReadingStoreException if the store fails
    public List<Reading> fetchMinute(String taskId, Interval minute, Set<String> locations)
            throws ReadingStoreException {
        List<Reading> readings = new ArrayList<>();
        for (Reading reading :
                sorted(store.queryReadings(taskId, minute.start(), minute.end(), locations))) {
            if (minute.containsHalfOpen(reading.timestamp())
                    && (locations.isEmpty() || locations.contains(reading.deviceId()))) {
                readings.add(reading);
            }
        }
        return readings;
    }

    /// Renders the query block shared by detail logs.
    ///
    /// @param locations queried devices, not null
    /// @param interval queried interval, not null
    /// @param hits number of readings returned
    /// @return three-line block, never null
    public static String queryInfo(Set<String> locations, Interval interval, int hits) {
        return "查询设备: "
                + Locations.join(locations)
                + "\n本地时间: "
                + TimeFormats.range(interval.start(), interval.end())
                + "\n命中: "
                + hits
                + " 条";
    }

    private static List<Reading> sorted(List<Reading> readings) {
        List<Reading> copy = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            if (reading != null) {
                copy.add(reading);
            }
        }
        copy.sort(Reading.CHRONOLOGICAL);
        return copy;
    }
}
