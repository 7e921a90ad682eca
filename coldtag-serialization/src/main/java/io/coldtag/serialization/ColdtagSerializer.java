package io.coldtag.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.Tag;
import java.time.ZoneId;
import java.util.List;

/// Utility class for reading and writing Coldtag rosters, readings and results as JSON.
///
/// ### Usage
/// {@snippet :
/// List<Tag> roster = ColdtagSerializer.readTags(json);
/// List<Reading> readings = ColdtagSerializer.readReadings(readingsJson, ZoneId.of("Asia/Shanghai"));
/// String out = ColdtagSerializer.toJson(roster);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`; cache one for
/// high-throughput use.
///
/// @see ColdtagJacksonModule for the registered type handlers
public final class ColdtagSerializer {

    private static final TypeReference<List<Tag>> TAGS = new TypeReference<>() {};
    private static final TypeReference<List<Reading>> READINGS = new TypeReference<>() {};

    private ColdtagSerializer() {}

    /// Serializes any Coldtag value (a tag, a roster, a result, readings) to pretty-printed
    /// JSON.
    ///
    /// @param value the value to serialize, may be null
    /// @return JSON string, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value: " + e.getMessage(), e);
        }
    }

    /// Reads a roster: a JSON array of tags.
    ///
    /// @param json JSON string, not null
    /// @return the tags in file order, never null
    /// @throws IllegalArgumentException if the JSON is not a valid roster
    public static List<Tag> readTags(String json) {
        return read(createMapper(), json, TAGS, "roster");
    }

    /// Reads a JSON array of readings, interpreting epoch and offset timestamps in the system
    /// zone.
    ///
    /// @param json JSON string, not null
    /// @return the readings in file order, never null
    /// @throws IllegalArgumentException if the JSON is not a valid reading list
    public static List<Reading> readReadings(String json) {
        return readReadings(json, ZoneId.systemDefault());
    }

    /// Reads a JSON array of readings.
    ///
    /// @param json JSON string, not null
    /// @param zone zone for epoch and offset timestamps, not null
    /// @return the readings in file order, never null
    /// @throws IllegalArgumentException if the JSON is not a valid reading list
    public static List<Reading> readReadings(String json, ZoneId zone) {
        return read(createMapper(zone), json, READINGS, "readings");
    }

    /// Reads one function config.
    ///
    /// @param json JSON string, not null
    /// @return the config, never null
    /// @throws IllegalArgumentException if the JSON is not a valid config
    public static FunctionConfig readConfig(String json) {
        return read(createMapper(), json, new TypeReference<FunctionConfig>() {}, "function config");
    }

    /// Reads one function result.
    ///
    /// @param json JSON string, not null
    /// @return the result, never null
    /// @throws IllegalArgumentException if the JSON is not a valid result
    public static FunctionResult readResult(String json) {
        return read(createMapper(), json, new TypeReference<FunctionResult>() {}, "result");
    }

    /// Creates an ObjectMapper configured for Coldtag serialization in the system zone.
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return createMapper(ZoneId.systemDefault());
    }

    /// Creates an ObjectMapper configured for Coldtag serialization.
    ///
    /// Registers:
    /// - `ColdtagJacksonModule` for the domain types
    /// - `JavaTimeModule` for the `Instant` of a run snapshot
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @param zone zone for epoch and offset reading timestamps, not null
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper(ZoneId zone) {
        return new ObjectMapper()
                .registerModule(new ColdtagJacksonModule(zone))
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static <T> T read(
            ObjectMapper mapper, String json, TypeReference<T> type, String what) {
        try {
            T value = mapper.readValue(json, type);
            if (value == null) {
                throw new IllegalArgumentException("Empty " + what + " document");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }
}
