package io.pipewright.core.stage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Declared input/output type signature of a stage.
///
/// Inputs are named ports in declaration order. Most stages have a single port
/// named {@link #DEFAULT_PORT}; a stage declaring more than one port opts into
/// multi-input composition, with exactly one inbound edge per port. Source
/// stages use their single port (if any) for the external run input.
///
/// ### Usage
/// {@snippet :
/// // single input
/// StageSignature.of(ThingList.class, GroupedThings.class);
///
/// // enrichment consuming both source and grouping outputs
/// StageSignature.builder()
///         .input("things", ThingList.class)
///         .input("groups", GroupedThings.class)
///         .output(EnrichedMetadata.class)
///         .build();
/// }
///
/// @implNote Immutable and thread-safe after construction.
public final class StageSignature {

    /// Port name used by single-input stages.
    public static final String DEFAULT_PORT = "input";

    private final Map<String, TypeDescriptor> inputs;
    private final TypeDescriptor output;

    private StageSignature(Map<String, TypeDescriptor> inputs, TypeDescriptor output) {
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.output = Objects.requireNonNull(output, "output type required");
    }

    /// Creates a single-input signature.
    ///
    /// @param input type accepted on the default port, not null
    /// @param output produced type, not null
    /// @return new signature, never null
    public static StageSignature of(Class<?> input, Class<?> output) {
        return builder().input(DEFAULT_PORT, input).output(output).build();
    }

    /// Creates a signature for a stage that takes no input at all.
    ///
    /// @param output produced type, not null
    /// @return new signature with no input ports, never null
    public static StageSignature producing(Class<?> output) {
        return builder().output(output).build();
    }

    /// Returns the declared input ports.
    ///
    /// @return unmodifiable map of port name to type, in declaration order, never null
    public Map<String, TypeDescriptor> getInputs() {
        return inputs;
    }

    /// Returns the type of a single port.
    ///
    /// @param port port name, not null
    /// @return descriptor, or null if the port is not declared
    public TypeDescriptor getInput(String port) {
        return inputs.get(port);
    }

    /// Returns the declared output type.
    ///
    /// @return output descriptor, never null
    public TypeDescriptor getOutput() {
        return output;
    }

    /// Returns whether the stage declares more than one input port.
    ///
    /// @return true for multi-input stages
    public boolean isMultiInput() {
        return inputs.size() > 1;
    }

    /// Returns the only port of a single-input stage.
    ///
    /// @return port name, or null if the stage has zero or several ports
    public String soleInputPort() {
        return inputs.size() == 1 ? inputs.keySet().iterator().next() : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link StageSignature}.
    public static final class Builder {
        private final Map<String, TypeDescriptor> inputs = new LinkedHashMap<>();
        private TypeDescriptor output = TypeDescriptor.NONE;

        private Builder() {}

        /// Declares an input port.
        ///
        /// @param port port name, not null or blank
        /// @param type accepted type, not null
        /// @return this builder for chaining
        /// @throws IllegalArgumentException if the port is blank or already declared
        public Builder input(String port, Class<?> type) {
            if (port == null || port.isBlank()) {
                throw new IllegalArgumentException("port name must not be blank");
            }
            if (inputs.putIfAbsent(port, TypeDescriptor.of(type)) != null) {
                throw new IllegalArgumentException("port '" + port + "' declared twice");
            }
            return this;
        }

        public Builder output(Class<?> type) {
            this.output = TypeDescriptor.of(type);
            return this;
        }

        public StageSignature build() {
            return new StageSignature(inputs, output);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StageSignature that)) return false;
        return inputs.equals(that.inputs) && output.equals(that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputs, output);
    }

    @Override
    public String toString() {
        return "StageSignature{inputs=" + inputs + ", output=" + output + "}";
    }
}
