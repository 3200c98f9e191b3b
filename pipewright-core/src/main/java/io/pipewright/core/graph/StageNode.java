package io.pipewright.core.graph;

import io.pipewright.core.stage.Stage;
import io.pipewright.core.stage.StageRole;
import io.pipewright.core.stage.StageSignature;
import io.pipewright.core.stage.TypeDescriptor;
import java.util.Objects;

/// A stage bound into a pipeline under a unique identifier.
///
/// The signature is captured once at construction so that validation and
/// execution see the same declared types.
///
/// @implNote Immutable. The node owns its stage instance exclusively.
public final class StageNode {

    private final String id;
    private final StageRole role;
    private final Stage stage;
    private final StageSignature signature;

    /// Creates a stage node.
    ///
    /// @param id identifier unique within the pipeline, not null or blank
    /// @param role stage role, not null
    /// @param stage stage implementation, not null
    /// @throws IllegalArgumentException if the identifier is blank
    /// @throws NullPointerException if the stage declares a null signature
    public StageNode(String id, StageRole role, Stage stage) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Stage id must not be blank");
        }
        this.id = id;
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.signature =
                Objects.requireNonNull(stage.signature(), "Stage '" + id + "' has no signature");
    }

    public String getId() {
        return id;
    }

    public StageRole getRole() {
        return role;
    }

    public Stage getStage() {
        return stage;
    }

    public StageSignature getSignature() {
        return signature;
    }

    public TypeDescriptor getOutputType() {
        return signature.getOutput();
    }

    /// Returns whether this node receives the external run input.
    ///
    /// @return true for {@link StageRole#SOURCE} nodes
    public boolean isSource() {
        return role == StageRole.SOURCE;
    }

    @Override
    public String toString() {
        return "StageNode{id='" + id + "', role=" + role + "}";
    }
}
