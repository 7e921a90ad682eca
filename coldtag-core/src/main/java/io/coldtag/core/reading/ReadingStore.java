package io.coldtag.core.reading;

import io.coldtag.core.exception.ReadingStoreException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/// Time-indexed read API of the external sensor-data store.
///
/// ### Contracts
/// - Both bounds are inclusive; callers needing a half-open window filter the end themselves.
/// - Bounds are naive local time, compared against reading timestamps without any offset.
/// - An empty `locationIds` set means no location filter.
/// - The returned list is treated as an immutable, unordered bag.
///
/// @implNote Implementations must be safe for concurrent reads; evaluations for different tags
/// may query in parallel.
public interface ReadingStore {

    /// Returns all readings of a task within a time window.
    ///
    /// @param taskId the task whose data is queried, not null
    /// @param start inclusive window start, not null
    /// @param end inclusive window end, not null
    /// @param locationIds device ids to keep, not null; empty for no filter
    /// @return matching readings, never null (may be empty)
    /// @throws ReadingStoreException if the store cannot answer
    List<Reading> queryReadings(
            String taskId, LocalDateTime start, LocalDateTime end, Set<String> locationIds)
            throws ReadingStoreException;
}
