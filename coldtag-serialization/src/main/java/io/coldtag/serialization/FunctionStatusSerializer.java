package io.coldtag.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.coldtag.core.result.FunctionStatus;
import java.io.IOException;
import java.io.Serial;

/// Writes a `FunctionStatus` as `"success"` or `"error"`.
///
/// @implNote Package-private. Registered by {@link ColdtagJacksonModule}.
class FunctionStatusSerializer extends StdSerializer<FunctionStatus> {

    @Serial private static final long serialVersionUID = 7781520664029318405L;

    FunctionStatusSerializer() {
        super(FunctionStatus.class);
    }

    @Override
    public void serialize(FunctionStatus status, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(status.getId());
    }
}
