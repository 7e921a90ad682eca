package io.coldtag.core.function;

import io.coldtag.core.tag.TagType;

/// Shape of the value a function kind produces, which decides the tag types that may host it.
public enum OutputCategory {

    /// A set of device identifiers, hosted by `location` tags.
    LOCATION,

    /// A number, hosted by `number` tags.
    NUMBER,

    /// A `YYYY-MM-DD HH:mm` timestamp, hosted by `date` and `datetime` tags.
    TIME;

    /// Resolves the category a tag type accepts.
    ///
    /// @param type the tag type, may be null
    /// @return the category, or null when the tag type cannot host a function
    public static OutputCategory forTagType(TagType type) {
        if (type == null) {
            return null;
        }
        return switch (type) {
            case LOCATION -> LOCATION;
            case NUMBER -> NUMBER;
            case DATE, DATETIME -> TIME;
            default -> null;
        };
    }
}
