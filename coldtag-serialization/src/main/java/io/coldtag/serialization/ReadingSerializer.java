package io.coldtag.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.coldtag.core.reading.Reading;
import java.io.IOException;
import java.io.Serial;
import java.time.format.DateTimeFormatter;

/// Serializes a `Reading` as a flat object.
///
/// Emitted JSON shape: `{"deviceId":"A","timestamp":"2024-01-15T09:00:00",
/// "temperature":4.5,"humidity":60.0}`. The timestamp is ISO local time without offset. A
/// missing (NaN) measure is written as `null`.
///
/// @implNote Package-private. Registered by {@link ColdtagJacksonModule}.
/// @see ReadingDeserializer for the inverse operation
class ReadingSerializer extends StdSerializer<Reading> {

    @Serial private static final long serialVersionUID = 3962457811420973550L;

    ReadingSerializer() {
        super(Reading.class);
    }

    @Override
    public void serialize(Reading reading, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("deviceId", reading.deviceId());
        gen.writeStringField(
                "timestamp", DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(reading.timestamp()));
        writeMeasure(gen, "temperature", reading.temperature());
        writeMeasure(gen, "humidity", reading.humidity());
        gen.writeEndObject();
    }

    private static void writeMeasure(JsonGenerator gen, String name, double value)
            throws IOException {
        if (Double.isNaN(value)) {
            gen.writeNullField(name);
        } else {
            gen.writeNumberField(name, value);
        }
    }
}
