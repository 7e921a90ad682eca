package io.coldtag.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.function.FunctionKind;
import java.util.Optional;

/// Jackson mixin that binds `FunctionConfig` deserialization to its builder.
///
/// The function kind is stored as its wire id in `functionType`; the derived
/// {@link FunctionConfig#getKind()} accessor is excluded so configs with an unknown type
/// still round-trip unchanged.
///
/// @apiNote The companion mixin {@link FunctionConfigBuilderMixin} must also be registered.
/// @see io.coldtag.serialization.ColdtagJacksonModule
@JsonDeserialize(builder = FunctionConfig.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class FunctionConfigMixin {

    @JsonIgnore
    public abstract Optional<FunctionKind> getKind();
}
