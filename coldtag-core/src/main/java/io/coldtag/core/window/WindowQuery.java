package io.coldtag.core.window;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// A resolved but not yet executed reading query.
///
/// @param interval the query interval, not null
/// @param locations device ids to query in first-appearance order, never null; empty means no
///     location filter
public record WindowQuery(Interval interval, Set<String> locations) {

    public WindowQuery {
        Objects.requireNonNull(interval, "interval must not be null");
        locations =
                locations != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(locations))
                        : Set.of();
    }
}
