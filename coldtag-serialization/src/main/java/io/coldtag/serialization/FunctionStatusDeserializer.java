package io.coldtag.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.coldtag.core.result.FunctionStatus;
import java.io.IOException;
import java.io.Serial;

/// Reads a `FunctionStatus` from its wire id, ignoring case.
///
/// @implNote Package-private. Registered by {@link ColdtagJacksonModule}.
class FunctionStatusDeserializer extends StdDeserializer<FunctionStatus> {

    @Serial private static final long serialVersionUID = -1429870053376120947L;

    FunctionStatusDeserializer() {
        super(FunctionStatus.class);
    }

    @Override
    public FunctionStatus deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        String id = p.getValueAsString();
        return FunctionStatus.fromId(id)
                .orElseThrow(
                        () ->
                                ctx.weirdStringException(
                                        id, FunctionStatus.class, "Unknown status: " + id));
    }
}
