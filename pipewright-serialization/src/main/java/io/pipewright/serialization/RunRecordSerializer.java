package io.pipewright.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pipewright.core.execution.result.RunRecord;

/// Utility class for serializing run records to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = RunRecordSerializer.toJson(record);
/// RunRecord restored = RunRecordSerializer.fromJson(json);
/// }
///
/// Restored records carry outputs as plain JSON values and failures without
/// their causes; see {@link PipewrightJacksonModule}.
///
/// @implNote Thread-safe. A mapper is created per call; cache
/// {@link #createMapper()} for high-throughput use.
public final class RunRecordSerializer {

    private RunRecordSerializer() {}

    /// Serializes a run record to pretty-printed JSON.
    ///
    /// @param record the record to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(RunRecord record) {
        try {
            return createMapper().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize run record: " + e.getMessage(), e);
        }
    }

    /// Deserializes a run record from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized record, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static RunRecord fromJson(String json) {
        try {
            return createMapper().readValue(json, RunRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize run record: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Pipewright types.
    ///
    /// Registers:
    /// - `PipewrightJacksonModule` for stage outcomes
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new PipewrightJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
