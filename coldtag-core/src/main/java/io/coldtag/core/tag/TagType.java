package io.coldtag.core.tag;

import java.util.Optional;

/// Type of a report field. Drives value coercion when a function writes its result back.
public enum TagType {
    TEXT("text"),
    NUMBER("number"),
    DATE("date"),
    DATETIME("datetime"),

    /// Holds a set of device/location identifiers.
    LOCATION("location"),
    BOOLEAN("boolean"),
    IMAGE("image"),
    CDA_IMAGE("cda-image");

    private final String id;

    TagType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /// Checks whether the type holds a date or date-time value.
    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    /// Resolves a tag type from its wire identifier.
    ///
    /// @param id identifier such as `"cda-image"`, may be null
    /// @return the matching type, or empty if unknown
    public static Optional<TagType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (TagType type : values()) {
            if (type.id.equalsIgnoreCase(id.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
