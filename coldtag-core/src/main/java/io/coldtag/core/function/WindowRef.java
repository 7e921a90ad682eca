package io.coldtag.core.function;

import java.util.List;

/// References to the tags that define a query window: the location tags whose devices are
/// queried and the tags holding the window's start and end.
///
/// @param locationTagIds location tag ids, never null
/// @param startTagId start time tag id, not null
/// @param endTagId end time tag id, not null
public record WindowRef(List<String> locationTagIds, String startTagId, String endTagId) {

    public WindowRef {
        locationTagIds = locationTagIds != null ? List.copyOf(locationTagIds) : List.of();
    }
}
