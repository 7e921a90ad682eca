package io.coldtag.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `Tag.Builder`.
///
/// Sets `withPrefix = ""` so JSON field names map straight onto the builder setters. Rosters
/// exported from the document store name the id `_id`; it is accepted as an alias of `id`.
///
/// @see TagMixin
@JsonPOJOBuilder(withPrefix = "")
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TagBuilderMixin {

    @JsonAlias("_id")
    public abstract TagBuilderMixin id(String id);
}
