package io.coldtag.core.tag;

import io.coldtag.core.function.FunctionConfig;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;

/// A named, typed field on a report template.
///
/// The value's shape depends on the {@link TagType}: location tags hold a delimited string or
/// a list of device identifiers, number tags a number or numeric text, date tags an epoch
/// number or date text. A tag may carry the {@link FunctionConfig} that derives its value.
///
/// @implNote Immutable. Collection values are copied on construction so a roster snapshot is
/// not affected by later caller mutation.
public final class Tag {

    private final String id;
    private final String name;
    private final String description;
    private final TagType type;
    private final Object value;
    private final FunctionConfig functionConfig;

    private Tag(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Tag ID required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description;
        this.type = Objects.requireNonNull(builder.type, "Tag type required");
        this.value = copyValue(builder.value);
        this.functionConfig = builder.functionConfig;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Collection) {
            return Collections.unmodifiableList(new ArrayList<>((Collection<?>) value));
        }
        return value;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public TagType getType() {
        return type;
    }

    /// Returns the raw tag value.
    ///
    /// @return the value, may be null
    public Object getValue() {
        return value;
    }

    /// Returns the function attached to this tag.
    ///
    /// @return the function config, null when the tag holds a literal value
    public FunctionConfig getFunctionConfig() {
        return functionConfig;
    }

    /// Returns a builder pre-populated with this tag's fields.
    public Builder toBuilder() {
        return builder()
                .id(id)
                .name(name)
                .description(description)
                .type(type)
                .value(value)
                .functionConfig(functionConfig);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Tag{id='" + id + "', type=" + type + ", value=" + value + '}';
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private TagType type;
        private Object value;
        private FunctionConfig functionConfig;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(TagType type) {
            this.type = type;
            return this;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder functionConfig(FunctionConfig functionConfig) {
            this.functionConfig = functionConfig;
            return this;
        }

        public Tag build() {
            return new Tag(this);
        }
    }
}
