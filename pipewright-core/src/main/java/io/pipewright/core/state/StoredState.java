package io.pipewright.core.state;

import java.time.Instant;
import java.util.Objects;

/// Last successful output of one stage of one pipeline.
///
/// Created or replaced by the execution engine after the stage succeeds, read
/// by the stage itself on the next run to compute incremental deltas. Never
/// deleted automatically.
///
/// @param pipelineId owning pipeline identifier, not null
/// @param stageId stage identifier within the pipeline, not null
/// @param output snapshot of the stage output, may be null
/// @param timestamp when the output was produced, not null
public record StoredState(String pipelineId, String stageId, Object output, Instant timestamp) {

    public StoredState {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        Objects.requireNonNull(stageId, "stageId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
