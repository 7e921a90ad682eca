package io.coldtag.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.coldtag.core.tag.TagType;
import java.io.IOException;
import java.io.Serial;

/// Writes a `TagType` as its lower-case wire id (`"location"`, `"cda-image"`).
///
/// @implNote Package-private. Registered by {@link ColdtagJacksonModule}.
/// @see TagTypeDeserializer for the inverse operation
class TagTypeSerializer extends StdSerializer<TagType> {

    @Serial private static final long serialVersionUID = 2204716518932735031L;

    TagTypeSerializer() {
        super(TagType.class);
    }

    @Override
    public void serialize(TagType type, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(type.getId());
    }
}
