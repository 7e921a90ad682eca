package io.coldtag.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.coldtag.core.tag.TagType;
import java.io.IOException;
import java.io.Serial;

/// Reads a `TagType` from its wire id.
///
/// @implNote Package-private. Registered by {@link ColdtagJacksonModule}.
/// @see TagTypeSerializer for the inverse operation
class TagTypeDeserializer extends StdDeserializer<TagType> {

    @Serial private static final long serialVersionUID = -6034721958610244712L;

    TagTypeDeserializer() {
        super(TagType.class);
    }

    @Override
    public TagType deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        String id = p.getValueAsString();
        return TagType.fromId(id)
                .orElseThrow(
                        () ->
                                ctx.weirdStringException(
                                        id, TagType.class, "Unknown tag type: " + id));
    }
}
