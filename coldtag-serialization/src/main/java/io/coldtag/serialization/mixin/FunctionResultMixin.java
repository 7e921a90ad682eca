package io.coldtag.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.coldtag.core.result.FunctionResult;

/// Jackson mixin that binds `FunctionResult` deserialization to its builder and drops the
/// derived `isSuccess()` flag from the written JSON.
///
/// @see FunctionResultBuilderMixin
@JsonDeserialize(builder = FunctionResult.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class FunctionResultMixin {

    @JsonIgnore
    public abstract boolean isSuccess();
}
