package io.pipewright.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.pipewright.core.execution.result.StageOutcome;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `StageOutcome` sealed hierarchy with a `"status"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`Succeeded`**: `{"status":"succeeded","output":...}`. A null output is omitted.
/// - **`Failed`**: `{"status":"failed","kind":"TRANSIENT","message":"...","cause":"..."}`.
///   The cause is written as its `toString()` and omitted when absent.
/// - **`Skipped`**: `{"status":"skipped","reason":"..."}`.
///
/// @implNote Package-private. Registered by {@link PipewrightJacksonModule}.
/// @see StageOutcomeDeserializer for the inverse operation
class StageOutcomeSerializer extends StdSerializer<StageOutcome> {

    @Serial private static final long serialVersionUID = -5139305887460210362L;

    StageOutcomeSerializer() {
        super(StageOutcome.class);
    }

    @Override
    public void serialize(StageOutcome outcome, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (outcome instanceof StageOutcome.Succeeded s) {
            gen.writeStringField("status", "succeeded");
            if (s.output() != null) {
                provider.defaultSerializeField("output", s.output(), gen);
            }
        } else if (outcome instanceof StageOutcome.Failed f) {
            gen.writeStringField("status", "failed");
            gen.writeStringField("kind", f.kind().name());
            gen.writeStringField("message", f.message());
            if (f.cause() != null) {
                gen.writeStringField("cause", f.cause().toString());
            }
        } else if (outcome instanceof StageOutcome.Skipped k) {
            gen.writeStringField("status", "skipped");
            gen.writeStringField("reason", k.reason());
        }

        gen.writeEndObject();
    }
}
