package io.pipewright.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.pipewright.core.execution.result.StageOutcome;
import io.pipewright.core.stage.FailureKind;
import java.io.IOException;
import java.io.Serial;

/// Deserializes the `StageOutcome` sealed hierarchy using a `"status"` discriminator field.
///
/// Outputs come back as plain JSON values (`String`, `Number`, `Boolean`, `List`,
/// `Map`), since the output type is not part of the document. Failure causes are
/// not restored; their text is lost.
///
/// @implNote Package-private. Registered by {@link PipewrightJacksonModule}.
/// @see StageOutcomeSerializer for the inverse operation
class StageOutcomeDeserializer extends StdDeserializer<StageOutcome> {

    @Serial private static final long serialVersionUID = 4472305198712639017L;

    StageOutcomeDeserializer() {
        super(StageOutcome.class);
    }

    /// Reads the `"status"` field and dispatches to the matching subtype.
    ///
    /// @param p the JSON parser positioned at the start of the outcome object, not null
    /// @param ctx the deserialization context, not null
    /// @return the deserialized outcome, never null
    /// @throws IOException if the status is unknown or a required field is absent
    @Override
    public StageOutcome deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String status = required(root, "status");

        return switch (status) {
            case "succeeded" -> {
                JsonNode output = root.get("output");
                yield new StageOutcome.Succeeded(
                        output == null || output.isNull()
                                ? null
                                : mapper.treeToValue(output, Object.class));
            }
            case "failed" -> {
                FailureKind kind;
                try {
                    kind = FailureKind.valueOf(required(root, "kind"));
                } catch (IllegalArgumentException e) {
                    throw new IOException("Unknown failure kind: " + root.get("kind"), e);
                }
                yield new StageOutcome.Failed(kind, required(root, "message"), null);
            }
            case "skipped" -> new StageOutcome.Skipped(required(root, "reason"));
            default -> throw new IOException("Unknown StageOutcome status: " + status);
        };
    }

    private static String required(JsonNode root, String field) throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("StageOutcome is missing field '" + field + "'");
        }
        return value.asText();
    }
}
