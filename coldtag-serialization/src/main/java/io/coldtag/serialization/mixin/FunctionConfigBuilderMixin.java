package io.coldtag.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.coldtag.core.function.FunctionKind;

/// Jackson mixin for `FunctionConfig.Builder`.
///
/// Only `functionType` carries the kind on the wire, so the typed `kind(...)` setter is
/// hidden from Jackson.
///
/// @see FunctionConfigMixin
@JsonPOJOBuilder(withPrefix = "")
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class FunctionConfigBuilderMixin {

    @JsonIgnore
    public abstract FunctionConfigBuilderMixin kind(FunctionKind kind);
}
