package io.coldtag.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.coldtag.core.normalize.TagDate;
import io.coldtag.core.normalize.TagDates;
import io.coldtag.core.normalize.TagValues;
import io.coldtag.core.reading.Reading;
import java.io.IOException;
import java.io.Serial;
import java.time.ZoneId;
import java.util.Objects;

/// Deserializes a `Reading` leniently.
///
/// The timestamp may be epoch milliseconds, `yyyy-MM-dd HH:mm[:ss]`, an ISO local string or an
/// ISO string with an offset; epoch and offset values are converted to local time in the
/// configured zone. Measures may be numbers, numeric strings or absent; anything that does
/// not parse becomes NaN and is later skipped by the metrics. Unknown fields such as `taskId`
/// or `_id` are ignored.
///
/// @implNote Package-private. Registered by {@link ColdtagJacksonModule}.
/// @see ReadingSerializer for the inverse operation
class ReadingDeserializer extends StdDeserializer<Reading> {

    @Serial private static final long serialVersionUID = -8173365093254412684L;

    private final ZoneId zone;

    ReadingDeserializer(ZoneId zone) {
        super(Reading.class);
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public Reading deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = p.readValueAsTree();

        JsonNode device = root.get("deviceId");
        if (device == null || device.isNull() || device.asText().isBlank()) {
            throw ctx.instantiationException(Reading.class, "Reading without deviceId");
        }

        TagDate timestamp = TagDates.parse(scalar(root.get("timestamp")), zone);
        if (!timestamp.isPresent()) {
            throw ctx.instantiationException(
                    Reading.class, "Reading with invalid timestamp: " + root.get("timestamp"));
        }

        return new Reading(
                device.asText().trim(),
                timestamp.dateTime(),
                measure(root.get("temperature")),
                measure(root.get("humidity")));
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isNumber() ? node.numberValue() : node.asText();
    }

    private static double measure(JsonNode node) {
        return TagValues.parseNumber(scalar(node)).orElse(Double.NaN);
    }
}
