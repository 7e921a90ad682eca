package io.coldtag.core.reading;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Thread-safe in-memory {@link ReadingStore} holding the readings of any number of tasks.
///
/// A task's readings are replaced wholesale by {@link #load(String, Collection)}; queries scan
/// the task's list and never return the stored instances' container.
public final class InMemoryReadingStore implements ReadingStore {

    private static final Logger logger = Logger.getLogger(InMemoryReadingStore.class.getName());

    private final Map<String, List<Reading>> storage = new ConcurrentHashMap<>();

    /// Replaces the readings of a task.
    ///
    /// @param taskId the task id, not null
    /// @param readings the task's readings, not null
    public void load(String taskId, Collection<Reading> readings) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(readings, "readings must not be null");
        storage.put(taskId, List.copyOf(readings));
        logger.fine("Loaded " + readings.size() + " readings for task " + taskId);
    }

    @Override
    public List<Reading> queryReadings(
            String taskId, LocalDateTime start, LocalDateTime end, Set<String> locationIds) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        Objects.requireNonNull(locationIds, "locationIds must not be null");

        List<Reading> taskReadings = storage.get(taskId);
        if (taskReadings == null) {
            logger.warning("No readings loaded for task " + taskId);
            return List.of();
        }

        List<Reading> matched = new ArrayList<>();
        for (Reading reading : taskReadings) {
            LocalDateTime ts = reading.timestamp();
            if (ts.isBefore(start) || ts.isAfter(end)) {
                continue;
            }
            if (!locationIds.isEmpty() && !locationIds.contains(reading.deviceId())) {
                continue;
            }
            matched.add(reading);
        }
        return matched;
    }

    /// Removes a task's readings.
    ///
    /// @param taskId the task id, not null
    /// @return true if readings were removed
    public boolean clear(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return storage.remove(taskId) != null;
    }
}
