package io.pipewright.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.pipewright.core.execution.result.StageOutcome;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the Pipewright serialization configuration.
///
/// **Custom serializer/deserializer pairs** (sealed hierarchies, a discriminator
/// field selects the subtype):
/// - `StageOutcome` - `StageOutcomeSerializer` / `StageOutcomeDeserializer`,
///   discriminator: `"status"`
///
/// Records such as `RunRecord` and `StoredState` bind through their canonical
/// constructors and need no further registration.
///
/// @see RunRecordSerializer for the convenience factory API
public class PipewrightJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2716940551873025310L;

    public PipewrightJacksonModule() {
        super("PipewrightJacksonModule");

        addSerializer(StageOutcome.class, new StageOutcomeSerializer());
        addDeserializer(StageOutcome.class, new StageOutcomeDeserializer());
    }
}
