package io.coldtag.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.coldtag.core.tag.Tag;

/// Jackson mixin that binds `Tag` deserialization to its builder.
///
/// Applied to `Tag.class` via `ColdtagJacksonModule.setupModule()`. Null fields (a tag
/// without a function, a tag without a description) are left out of the written JSON.
///
/// @apiNote The companion mixin {@link TagBuilderMixin} must also be registered.
/// @see io.coldtag.serialization.ColdtagJacksonModule
@JsonDeserialize(builder = Tag.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class TagMixin {}
